package mstate.cluster;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import mstate.util.Algebra;

/**
 * Reference microstate maps used to put fitted maps in a canonical order.
 * The table is versioned so that a change of the reference values is visible
 * to anyone who stored an order computed against an older one.
 */
public final class ReferenceTemplate {

	public final static int VERSION = 1;

	private final static String[] CHANNEL_NAMES = new String[] {
			"Fp1", "Fp2", "F7", "F3", "Fz", "F4", "F8", "FC3", "FCz",
			"FC4", "T3", "C3", "Cz", "C4", "T4", "CP3", "CPz", "CP4",
			"T5", "P3", "Pz", "P4", "T6", "O1", "Oz", "O2"
	};

	private final static double[][] MAPS = new double[][] {
		{-0.13234463, -0.19008217, -0.01808156, -0.06665204, -0.18127315,
			-0.25741473, -0.2313206 ,  0.04239534, -0.14411298, -0.25635016,
			0.1831745 ,  0.17520883, -0.06034687, -0.21948988, -0.2057277 ,
			0.27723199,  0.04632557, -0.1383458 ,  0.36954792,  0.33889126,
			0.1425386 , -0.05140216, -0.07532628,  0.32313928,  0.21629226,
			0.11352515},
		{-0.15034466, -0.08511373, -0.19531161, -0.24267313, -0.16871454,
			-0.04761393,  0.02482456, -0.26414511, -0.15066143,  0.04628036,
			-0.1973625 , -0.24065874, -0.08569745,  0.1729162 ,  0.22345117,
			-0.17553494,  0.00688743,  0.25853483, -0.09196588, -0.09478585,
			0.09460047,  0.32742083,  0.4325027 ,  0.09535141,  0.1959104 ,
			0.31190313},
		{ 0.29388541,  0.2886461 ,  0.27804376,  0.22674127,  0.21938115,
			0.21720292,  0.25153101,  0.12125869,  0.10996983,  0.10638135,
			0.11575272, -0.01388831, -0.04507772, -0.03708886,  0.08203929,
			-0.14818182, -0.20299531, -0.16658826, -0.09488949, -0.23512102,
			-0.30464665, -0.25762648, -0.14058166, -0.22072284, -0.22175042,
			-0.22167467},
		{-0.21660409, -0.22350361, -0.27855619, -0.0097109 ,  0.07119601,
			0.00385336, -0.24792901,  0.08145982,  0.23290418,  0.09985582,
			-0.24242583,  0.13516244,  0.3304661 ,  0.16710186, -0.21832217,
			0.15575575,  0.33346027,  0.18885162, -0.21687347,  0.10926662,
			0.26182733,  0.13760157, -0.19536083, -0.15966419, -0.14684497,
			-0.15296749},
		{-0.12444958, -0.12317709, -0.06189361, -0.20820917, -0.25736043,
			-0.20740485, -0.06941215, -0.18086612, -0.26979589, -0.17602898,
			0.05332203, -0.10101208, -0.20095764, -0.09582802,  0.06883067,
			0.0082463 , -0.07052899,  0.00917889,  0.26984673,  0.13288481,
			0.08062487,  0.13616082,  0.30845643,  0.36843231,  0.35510687,
			0.35583386}
	};

	private ReferenceTemplate() {}

	public static double[][] maps() {
		return Algebra.copy(MAPS);
	}

	public static List<String> channelNames() {
		return Collections.unmodifiableList(Arrays.asList(CHANNEL_NAMES));
	}

	public static int nMaps() {
		return MAPS.length;
	}
}
