package mstate.util;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;

/** Sample-index interval helpers. */
public class Intervals {

	/**
	 * Maximal closed-open ranges within {@code [from, to)} that no excluded
	 * range touches, ascending.
	 */
	public static List<Range<Integer>> retained(int from, int to,
			Iterable<Range<Integer>> excluded) {
		RangeSet<Integer> kept = TreeRangeSet.create();
		if(to>from) kept.add(Range.closedOpen(from, to));
		if(excluded!=null)
			for(Range<Integer> r : excluded) kept.remove(r);
		List<Range<Integer>> ranges = new ArrayList<Range<Integer>>();
		for(Range<Integer> r : kept.asRanges()) {
			r = r.canonical(DiscreteDomain.integers());
			if(!r.isEmpty()) ranges.add(r);
		}
		return ranges;
	}

	/** Parses {@code "start-end,start-end"} into closed-open ranges. */
	public static RangeSet<Integer> parse(String spec) {
		RangeSet<Integer> set = TreeRangeSet.create();
		if(spec==null || spec.trim().isEmpty()) return set;
		for(String s : spec.split(",")) {
			String[] se = s.trim().split("-");
			if(se.length!=2)
				throw new IllegalArgumentException("Malformed interval "+s+", expected start-end.");
			set.add(Range.closedOpen(Integer.parseInt(se[0].trim()),
					Integer.parseInt(se[1].trim())));
		}
		return set;
	}
}
