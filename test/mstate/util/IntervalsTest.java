package mstate.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;

public class IntervalsTest {

	@Test
	public void testParse() {
		RangeSet<Integer> set = Intervals.parse("10-20, 15-30,40-41");
		assertEquals(2, set.asRanges().size());
		assertTrue(set.encloses(Range.closedOpen(10, 30)));
		assertTrue(set.contains(40));
		assertTrue(!set.contains(41));
		assertTrue(Intervals.parse("").isEmpty());
		assertTrue(Intervals.parse(null).isEmpty());
		assertThrows(IllegalArgumentException.class, () -> Intervals.parse("10"));
		assertThrows(NumberFormatException.class, () -> Intervals.parse("a-b"));
	}

	@Test
	public void testRetained() {
		assertEquals(Arrays.asList(Range.closedOpen(0, 5), Range.closedOpen(9, 12), Range.closedOpen(15, 20)),
				Intervals.retained(0, 20, Arrays.asList(Range.closedOpen(5, 9), Range.closed(12, 14))));
		assertEquals(Arrays.asList(Range.closedOpen(3, 7)),
				Intervals.retained(3, 7, Collections.<Range<Integer>>emptyList()));
		assertTrue(Intervals.retained(0, 10, Arrays.asList(Range.closedOpen(-5, 50))).isEmpty());
		assertTrue(Intervals.retained(5, 5, null).isEmpty());
	}
}
