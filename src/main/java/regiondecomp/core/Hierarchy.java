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
package regiondecomp.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Groups the regions of a decomposition by the choices leading to them. Inner
 * nodes correspond to choices shared by every region beneath them, whilst
 * leaves correspond to regions. This is intended for use by any presentation
 * layer wishing to show how a decomposition was derived.
 *
 * @author David J. Pearce
 *
 */
public class Hierarchy {

	public static Node build(Decomposition decomposition) {
		Node root = new Node(null, null);
		for (Region region : decomposition.getRegions()) {
			Node n = root;
			for (Choice choice : region.getProvenance()) {
				n = n.enter(choice);
			}
			n.children.add(new Node(null, region));
		}
		return root;
	}

	public static class Node {
		private final Choice choice;
		private final Region region;
		private final ArrayList<Node> children = new ArrayList<>();

		private Node(Choice choice, Region region) {
			this.choice = choice;
			this.region = region;
		}

		/**
		 * Get the choice made at this node, or <code>null</code> for the root and
		 * for leaves.
		 *
		 * @return
		 */
		public Choice getChoice() {
			return choice;
		}

		/**
		 * Get the region at this leaf, or <code>null</code> if this is not a leaf.
		 *
		 * @return
		 */
		public Region getRegion() {
			return region;
		}

		public boolean isLeaf() {
			return region != null;
		}

		public List<Node> getChildren() {
			return Collections.unmodifiableList(children);
		}

		/**
		 * Get all regions beneath this node, in order.
		 *
		 * @return
		 */
		public List<Region> getRegions() {
			ArrayList<Region> regions = new ArrayList<>();
			collect(regions);
			return regions;
		}

		private void collect(List<Region> regions) {
			if (region != null) {
				regions.add(region);
			}
			for (Node child : children) {
				child.collect(regions);
			}
		}

		private Node enter(Choice choice) {
			for (Node child : children) {
				if (!child.isLeaf() && child.choice.equals(choice)) {
					return child;
				}
			}
			Node n = new Node(choice, null);
			children.add(n);
			return n;
		}

		@Override
		public String toString() {
			StringBuilder builder = new StringBuilder();
			toString(builder, "");
			return builder.toString();
		}

		private void toString(StringBuilder builder, String indent) {
			if (region != null) {
				builder.append(indent).append("Region ").append(region.getId()).append(": ")
						.append(region.getInvariant()).append("\n");
			} else if (choice != null) {
				builder.append(indent).append(choice).append("\n");
			}
			String nindent = choice == null && region == null ? indent : indent + "  ";
			for (Node child : children) {
				child.toString(builder, nindent);
			}
		}
	}
}
