package org.janelia.util.concurrent;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntBinaryOperator;
import java.util.function.IntConsumer;

/**
 * Fixed-size thread pool that processes index ranges [0, totalSize) by interleaving
 * the indices between the worker threads.
 * Tasks submitted by a single call must write to disjoint locations.
 */
public class MultithreadedExecutor implements AutoCloseable
{
	private final ExecutorService threadPool;
	private final int numThreads;

	public MultithreadedExecutor( final int numThreads )
	{
		this( Executors.newFixedThreadPool( numThreads ), numThreads );
	}

	public MultithreadedExecutor( final ExecutorService threadPool, final int numThreads )
	{
		if ( numThreads < 1 )
			throw new IllegalArgumentException( "number of threads should be positive, got " + numThreads );

		this.threadPool = threadPool;
		this.numThreads = numThreads;
	}

	@Override
	public void close()
	{
		threadPool.shutdown();
	}

	public void run( final IntConsumer func, final int totalSize ) throws InterruptedException, ExecutionException
	{
		run( ( thread, i ) -> { func.accept( i ); return i; }, totalSize );
	}

	/**
	 * Calls {@code func( thread, i )} for every index in [0, totalSize), where {@code thread} is
	 * the index of the worker in [0, numThreads) that processes {@code i}.
	 */
	public void run( final IntBinaryOperator func, final int totalSize ) throws InterruptedException, ExecutionException
	{
		final int activeThreads = Math.min( numThreads, Math.max( totalSize, 1 ) );
		final AtomicInteger ai = new AtomicInteger();
		final Future< ? >[] futures = new Future[ activeThreads ];

		for ( int ithread = 0; ithread < activeThreads; ++ithread )
			futures[ ithread ] = threadPool.submit( () ->
			{
				final int myNumber = ai.getAndIncrement();
				for ( int i = myNumber; i < totalSize; i += activeThreads )
					func.applyAsInt( myNumber, i );
			});

		for ( final Future< ? > future : futures )
			future.get();
	}
}
