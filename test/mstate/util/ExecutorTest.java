package mstate.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Enumeration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.log4j.Logger;
import org.junit.jupiter.api.Test;

public class ExecutorTest {

	private static class Echo extends Executor {
		private String value = null;

		@Override
		public String getName() {
			return "echo";
		}

		@Override
		protected Options options() {
			Options options = new Options();
			options.addOption(Option.builder("v").longOpt("value").hasArg().required().build());
			return options;
		}

		@Override
		protected void configure(CommandLine cmd) {
			value = cmd.getOptionValue("v");
		}

		@Override
		public void run() {}
	}

	private static int rootAppenders() {
		int n = 0;
		for(Enumeration<?> e = Logger.getRootLogger().getAllAppenders(); e.hasMoreElements(); e.nextElement()) n++;
		return n;
	}

	@Test
	public void testKeepsExistingLogConfiguration() {
		int before = rootAppenders();
		new Echo();
		assertEquals(before, rootAppenders());
		assertEquals(1, rootAppenders());
	}

	@Test
	public void testSetParameters() {
		Echo echo = new Echo();
		echo.setParameters(new String[] {"--value", "42"});
		assertEquals("42", echo.value);
		assertThrows(IllegalArgumentException.class, () -> new Echo().setParameters(new String[0]));
		assertThrows(IllegalArgumentException.class, () -> new Echo().setParameters(new String[] {"-x"}));
	}

	@Test
	public void testPoolRunsEveryTask() {
		ExecutorService pool = Executor.newThreadPool(2);
		final AtomicInteger done = new AtomicInteger();
		for(int i=0; i<20; i++) {
			pool.submit(new Runnable() {
				@Override
				public void run() {
					done.incrementAndGet();
				}
			});
		}
		Executor.shutdown(pool);
		assertEquals(20, done.get());
	}
}
