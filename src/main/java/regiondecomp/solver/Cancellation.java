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
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A token shared between the submitter of a solver request and the worker
 * executing it. Solvers register listeners (e.g. to interrupt a native
 * context) which are run once when the token is cancelled.
 *
 * @author David J. Pearce
 *
 */
public class Cancellation {
	private final AtomicBoolean cancelled = new AtomicBoolean();
	private volatile String reason;
	private final ArrayList<Runnable> listeners = new ArrayList<>();

	/**
	 * Cancel this request for a given reason. This has no effect if the request
	 * was already cancelled.
	 *
	 * @param reason
	 */
	public void cancel(String reason) {
		if (cancelled.compareAndSet(false, true)) {
			this.reason = reason;
			Runnable[] rs;
			synchronized (this) {
				rs = listeners.toArray(new Runnable[listeners.size()]);
			}
			for (Runnable r : rs) {
				r.run();
			}
		}
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	/**
	 * Get the reason given when this was cancelled, or <code>null</code> if it
	 * has not been cancelled.
	 *
	 * @return
	 */
	public String getReason() {
		return reason;
	}

	/**
	 * Register a listener to be run on cancellation. If already cancelled, the
	 * listener is run immediately.
	 *
	 * @param listener
	 */
	public void addListener(Runnable listener) {
		synchronized (this) {
			if (!cancelled.get()) {
				listeners.add(listener);
				return;
			}
		}
		listener.run();
	}

	public synchronized void removeListener(Runnable listener) {
		listeners.remove(listener);
	}
}
