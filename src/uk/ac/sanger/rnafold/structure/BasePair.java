// Copyright (c) 2001-2014 Genome Research Ltd.
//
// Authors: David Harper
//          Ed Zuiderwijk
//          Kate Taylor
//
// This file is part of RnaFold.
//
// RnaFold is free software: you can redistribute it and/or modify it under
// the terms of the GNU General Public License as published by the Free Software
// Foundation; either version 3 of the License, or (at your option) any later
// version.
//
// This program is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// this program. If not, see <http://www.gnu.org/licenses/>.

package uk.ac.sanger.rnafold.structure;

public class BasePair {
	private final int left;
	private final int right;

	public BasePair(int left, int right) {
		if (left < 0 || right <= left)
			throw new IllegalArgumentException("Invalid base pair (" + left + ", "
					+ right + ")");

		this.left = left;
		this.right = right;
	}

	public int getLeft() {
		return left;
	}

	public int getRight() {
		return right;
	}

	public int getSpan() {
		return right - left;
	}

	/**
	 * Two pairs cross if exactly one end of one lies strictly inside the
	 * other. Nested and disjoint pairs do not cross.
	 */
	public boolean crosses(BasePair that) {
		BasePair first = left < that.left ? this : that;
		BasePair second = first == this ? that : this;

		return first.left < second.left && second.left <= first.right
				&& first.right < second.right;
	}

	public boolean equals(Object o) {
		if (!(o instanceof BasePair))
			return false;

		BasePair that = (BasePair) o;

		return left == that.left && right == that.right;
	}

	public int hashCode() {
		return 31 * left + right;
	}

	public String toString() {
		return "BasePair[" + left + ":" + right + "]";
	}
}
