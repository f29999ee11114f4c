package mstate.appl;

import org.apache.log4j.Logger;

import mstate.tools.Backfitter;
import mstate.tools.Fitter;
import mstate.tools.Transformer;
import mstate.util.Executor;

public class Microstates {

	protected final static Logger myLogger = Logger.getLogger(Microstates.class);

	public static void main(String[] args) {

		if(args.length<1) {
			printUsage();
			throw new RuntimeException("Undefined tool!!!");
		}
		String[] args2 = new String[args.length-1];
		System.arraycopy(args, 1, args2, 0, args2.length);
		Executor tool = tool(args[0]);
		if(tool==null) {
			printUsage();
			throw new RuntimeException("Undefined tool: "+args[0]);
		}
		tool.setParameters(args2);
		tool.run();
	}

	static Executor tool(String name) {
		switch(name.toLowerCase()) {
		case "fit":
			return new Fitter();
		case "backfit":
			return new Backfitter();
		case "transform":
			return new Transformer();
		default:
			return null;
		}
	}

	private static void printUsage() {
		myLogger.info(
				"\n\nUsage is as follows:\n"
						+ " fit             Fit microstate maps with modified K-means.\n"
						+ " backfit         Label samples with fitted maps.\n"
						+ " transform       Absolute correlation with the closest fitted map.\n\n");
	}
}
