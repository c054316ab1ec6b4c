// This file is part of the RegionDecomp Library (rdl).
//
// The RegionDecomp Library is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The RegionDecomp Library is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the RegionDecomp Library. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package regiondecomp.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import regiondecomp.core.Status;

/**
 * Runs solver queries on a fixed pool of worker threads. Every query is given
 * its own cancellation token and a wall clock deadline, measured from when it
 * starts running. A query reaching its deadline is cancelled and yields an
 * unknown status, without affecting any other query. If the solver does not
 * respond to cancellation within a short grace period, the request is
 * abandoned. Closing a dispatcher cancels every request which has not yet
 * completed.
 *
 * @author David J. Pearce
 *
 */
public class Dispatcher implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

	public static final String TIMEOUT = "timeout";

	public static final String CLOSED = "closed";

	/**
	 * Time allowed for a solver to respond to cancellation before its request is
	 * abandoned.
	 */
	private static final long GRACE = 1000;

	private final Solver solver;
	/**
	 * Worker threads on which queries are run.
	 */
	private final ExecutorService executor;
	/**
	 * Thread responsible for enforcing deadlines.
	 */
	private final ScheduledExecutorService watchdog;
	/**
	 * Deadline for each query, in milliseconds.
	 */
	private final long timeout;
	/**
	 * Requests which have been submitted but not yet run to completion.
	 */
	private final Set<Request> pending = ConcurrentHashMap.newKeySet();

	public Dispatcher(Solver solver, int nthreads, long timeout) {
		if (nthreads <= 0) {
			throw new IllegalArgumentException("invalid dispatch width");
		}
		this.solver = solver;
		this.timeout = timeout;
		this.executor = Executors.newFixedThreadPool(nthreads, DAEMON);
		this.watchdog = Executors.newSingleThreadScheduledExecutor(DAEMON);
	}

	/**
	 * Submit a query to be run at some point in the future.
	 *
	 * @param query
	 * @return
	 */
	public Request submit(Query query) {
		final Cancellation cancellation = new Cancellation();
		final FutureTask<Status> task = new FutureTask<>(() -> solver.check(query, cancellation));
		final Request request = new Request(query, task, cancellation);
		pending.add(request);
		try {
			executor.execute(() -> {
				if (task.isDone()) {
					// Cancelled whilst queued
					pending.remove(request);
					return;
				}
				ScheduledFuture<?> alarm = watchdog.schedule(() -> cancellation.cancel(TIMEOUT), timeout,
						TimeUnit.MILLISECONDS);
				ScheduledFuture<?> abandon = watchdog.schedule(() -> task.cancel(true), timeout + GRACE,
						TimeUnit.MILLISECONDS);
				try {
					task.run();
				} finally {
					alarm.cancel(false);
					abandon.cancel(false);
					pending.remove(request);
				}
			});
		} catch (RejectedExecutionException e) {
			// Dispatcher already closed
			request.cancel(CLOSED);
			pending.remove(request);
		}
		return request;
	}

	/**
	 * Run a list of queries and wait for all of them, returning their outcomes in
	 * the same order.
	 *
	 * @param queries
	 * @return
	 */
	public List<Status> run(List<Query> queries) {
		ArrayList<Request> requests = new ArrayList<>();
		for (Query q : queries) {
			requests.add(submit(q));
		}
		ArrayList<Status> results = new ArrayList<>();
		for (Request r : requests) {
			results.add(r.get());
		}
		return results;
	}

	@Override
	public void close() {
		for (Request r : pending) {
			r.cancel(CLOSED);
		}
		pending.clear();
		executor.shutdownNow();
		watchdog.shutdownNow();
	}

	/**
	 * A query which has been submitted to this dispatcher.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Request {
		private final Query query;
		private final FutureTask<Status> task;
		private final Cancellation cancellation;

		private Request(Query query, FutureTask<Status> task, Cancellation cancellation) {
			this.query = query;
			this.task = task;
			this.cancellation = cancellation;
		}

		public Query getQuery() {
			return query;
		}

		/**
		 * Cancel this request for a given reason.
		 *
		 * @param reason
		 */
		public void cancel(String reason) {
			cancellation.cancel(reason);
			task.cancel(true);
		}

		/**
		 * Wait for the outcome of this request. Any failure of the solver is
		 * reported as an unknown status.
		 *
		 * @return
		 */
		public Status get() {
			Status status;
			try {
				status = task.get();
			} catch (CancellationException e) {
				String reason = cancellation.getReason();
				status = new Status.Unknown(reason == null ? "cancelled" : reason);
			} catch (ExecutionException e) {
				logger.warn("solver failed on {}", query, e.getCause());
				status = new Status.Unknown(String.valueOf(e.getCause()));
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				cancel("interrupted");
				status = new Status.Unknown("interrupted");
			}
			logger.debug("{} ==> {}", query, status);
			return status;
		}
	}

	private static final ThreadFactory DAEMON = r -> {
		Thread t = new Thread(r, "regiondecomp-solver");
		t.setDaemon(true);
		return t;
	};
}
