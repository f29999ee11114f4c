package mstate.util;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Logger;

/** Base of the command-line tools: option parsing, logging and a worker pool. */
public abstract class Executor {

	protected final static Logger myLogger =
			Logger.getLogger(Executor.class);
	static {
		if(!Logger.getRootLogger().getAllAppenders().hasMoreElements())
			BasicConfigurator.configure();
	}

	protected int THREADS = 1;

	public abstract String getName();

	protected abstract Options options();

	/** Reads parsed options into fields; throws on invalid values. */
	protected abstract void configure(CommandLine cmd);

	public abstract void run();

	public void printUsage() {
		HelpFormatter formatter = new HelpFormatter();
		formatter.printHelp(getName(), options());
	}

	public void setParameters(String[] args) {
		if (args.length == 0) {
			printUsage();
			throw new IllegalArgumentException("\n\nPlease use the above arguments/options.\n\n");
		}
		CommandLineParser parser = new DefaultParser();
		try {
			configure(parser.parse(options(), args));
		} catch (ParseException e) {
			printUsage();
			throw new IllegalArgumentException(e.getMessage(), e);
		}
	}

	/**
	 * Fixed pool whose queue holds one task per worker; a submit that finds the
	 * queue full blocks until a slot frees up instead of being rejected.
	 */
	public static ExecutorService newThreadPool(int threads) {
		final BlockingQueue<Runnable> tasks = new ArrayBlockingQueue<Runnable>(threads);
		return new ThreadPoolExecutor(threads,
				threads,
				1,
				TimeUnit.SECONDS,
				tasks,
				new RejectedExecutionHandler(){
			@Override
			public void rejectedExecution(Runnable task,
					ThreadPoolExecutor pool) {
				if(pool.isShutdown())
					throw new RejectedExecutionException("Pool is shut down.");
				try {
					tasks.put(task);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new RejectedExecutionException(e);
				}
			}
		});
	}

	public static void shutdown(ExecutorService executor) {
		try {
			executor.shutdown();
			executor.awaitTermination(365, TimeUnit.DAYS);
		} catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
			throw new RuntimeException("Interrupted while waiting for workers.", e);
		}
	}
}
