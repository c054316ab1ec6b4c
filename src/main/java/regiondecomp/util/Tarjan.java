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
package regiondecomp.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Tarjan's algorithm for computing the strongly connected components of a
 * directed graph given in adjacency list form. This is used to identify
 * groups of mutually recursive functions in the call graph.
 *
 * @author David J. Pearce
 *
 */
public class Tarjan {
	/** number of vertices **/
	private int V;
	/** preorder number counter **/
	private int preCount;
	/** low number of v **/
	private int[] low;
	/** to check if v is visited **/
	private boolean[] visited;
	/** component assigned to each vertex **/
	private int[] component;
	/** size of each component, indexed by component **/
	private int[] sizes;
	private List<Integer>[] graph;
	private int sccCount;
	private final Deque<Integer> stack = new ArrayDeque<>();

	/**
	 * Compute the strongly connected components of a given graph, returning the
	 * component index of each vertex.
	 *
	 * @param graph
	 *            Adjacency lists, one per vertex.
	 * @return
	 */
	public int[] getSCComponents(List<Integer>[] graph) {
		V = graph.length;
		this.graph = graph;
		low = new int[V];
		visited = new boolean[V];
		component = new int[V];
		sizes = new int[V];
		preCount = 0;
		sccCount = 0;
		stack.clear();
		for (int v = 0; v < V; v++) {
			if (!visited[v]) {
				dfs(v);
			}
		}
		return component;
	}

	/**
	 * Get the number of components found by the last call to
	 * {@link #getSCComponents(List[])}.
	 *
	 * @return
	 */
	public int size() {
		return sccCount;
	}

	/**
	 * Get the number of vertices in a given component.
	 *
	 * @param c
	 * @return
	 */
	public int sizeOf(int c) {
		return sizes[c];
	}

	private void dfs(int v) {
		low[v] = preCount++;
		visited[v] = true;
		stack.push(v);
		int min = low[v];
		for (int w : graph[v]) {
			if (!visited[w]) {
				dfs(w);
			}
			if (low[w] < min) {
				min = low[w];
			}
		}
		if (min < low[v]) {
			low[v] = min;
			return;
		}
		int w;
		do {
			w = stack.pop();
			component[w] = sccCount;
			sizes[sccCount]++;
			low[w] = V;
		} while (w != v);
		sccCount += 1;
	}
}
