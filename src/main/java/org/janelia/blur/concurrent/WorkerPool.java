package org.janelia.blur.concurrent;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.log4j.Logger;

/**
 * Fixed set of long-lived worker threads pulling jobs from a single shared FIFO queue.
 *
 * All workers are started when the pool is created and stay alive until the pool is closed.
 * A job that throws is logged and counted, and its worker goes on serving the next jobs.
 * Closing the pool rejects new jobs, lets the workers drain everything that has been queued,
 * and blocks until all of them have terminated.
 */

public class WorkerPool implements AutoCloseable
{
	private static final Logger LOG = Logger.getLogger( WorkerPool.class );

	private static final AtomicInteger poolCounter = new AtomicInteger();

	private final ThreadPoolExecutor threadPool;
	private final int numWorkers;

	private final AtomicLong completedJobs = new AtomicLong();
	private final AtomicLong failedJobs = new AtomicLong();

	public WorkerPool( final int numWorkers )
	{
		if ( numWorkers < 1 )
			throw new IllegalArgumentException( "number of workers should be positive, got " + numWorkers );

		this.numWorkers = numWorkers;
		threadPool = new ThreadPoolExecutor(
				numWorkers,
				numWorkers,
				0L, TimeUnit.MILLISECONDS,
				new LinkedBlockingQueue<>(),
				new WorkerThreadFactory( poolCounter.incrementAndGet() ) );
		threadPool.prestartAllCoreThreads();
	}

	/**
	 * Enqueues the {@code job} and returns immediately.
	 *
	 * @throws IllegalStateException if the pool has been closed
	 */
	public void submit( final Runnable job )
	{
		if ( job == null )
			throw new NullPointerException( "job" );

		try
		{
			threadPool.execute( () -> runJob( job ) );
		}
		catch ( final RejectedExecutionException e )
		{
			throw new IllegalStateException( "worker pool has been closed", e );
		}
	}

	private void runJob( final Runnable job )
	{
		try
		{
			job.run();
		}
		catch ( final RuntimeException e )
		{
			failedJobs.incrementAndGet();
			LOG.error( "Job failed in " + Thread.currentThread().getName(), e );
		}
		finally
		{
			completedJobs.incrementAndGet();
		}
	}

	/**
	 * Stops accepting new jobs and waits until every queued job has been executed
	 * and every worker thread has terminated. Calling it again has no effect.
	 * If the calling thread is interrupted while waiting, the pool is still drained
	 * and the interrupt status is restored before returning.
	 */
	@Override
	public void close()
	{
		threadPool.shutdown();

		boolean interrupted = false;
		try
		{
			while ( true )
			{
				try
				{
					if ( threadPool.awaitTermination( 1, TimeUnit.MINUTES ) )
						break;
					LOG.info( "Waiting for " + threadPool.getQueue().size() + " queued jobs and " + threadPool.getActiveCount() + " running jobs to finish" );
				}
				catch ( final InterruptedException e )
				{
					interrupted = true;
				}
			}
		}
		finally
		{
			if ( interrupted )
				Thread.currentThread().interrupt();
		}
	}

	public boolean isClosed()
	{
		return threadPool.isShutdown();
	}

	public int getNumWorkers()
	{
		return numWorkers;
	}

	/**
	 * @return number of worker threads that are currently alive
	 */
	public int getLiveWorkerCount()
	{
		return threadPool.getPoolSize();
	}

	/**
	 * @return number of finished jobs, including the failed ones
	 */
	public long getCompletedJobCount()
	{
		return completedJobs.get();
	}

	public long getFailedJobCount()
	{
		return failedJobs.get();
	}

	private static class WorkerThreadFactory implements ThreadFactory
	{
		private final int poolIndex;
		private final AtomicInteger workerCounter = new AtomicInteger();

		WorkerThreadFactory( final int poolIndex )
		{
			this.poolIndex = poolIndex;
		}

		@Override
		public Thread newThread( final Runnable runnable )
		{
			final Thread thread = new Thread( runnable, "blur-worker-" + poolIndex + "-" + workerCounter.incrementAndGet() );
			thread.setDaemon( false );
			return thread;
		}
	}
}
