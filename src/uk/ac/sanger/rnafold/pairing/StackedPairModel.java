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

package uk.ac.sanger.rnafold.pairing;

import uk.ac.sanger.rnafold.structure.StackedBracketRenderer;
import uk.ac.sanger.rnafold.structure.StructureRenderer;

/**
 * Pairs the dinucleotide which starts at position i with the dinucleotide
 * which starts at position j. Both dinucleotides must be legal, and the score
 * is looked up in the stacking matrix. The final position of a sequence
 * starts no dinucleotide, so it never pairs.
 */
public class StackedPairModel implements PairingModel {
	private final String name;
	private final StackingMatrix matrix;
	private final StructureRenderer renderer = new StackedBracketRenderer();

	public StackedPairModel(String name, StackingMatrix matrix) {
		if (name == null || matrix == null)
			throw new IllegalArgumentException("Name and stacking matrix must not be null");

		this.name = name;
		this.matrix = matrix;
	}

	public String getName() {
		return name;
	}

	public StackingMatrix getMatrix() {
		return matrix;
	}

	private int getDinucleotideIndex(char[] sequence, int position) {
		if (position < 0 || position + 1 >= sequence.length)
			return -1;

		return matrix.getIndex(sequence[position], sequence[position + 1]);
	}

	public boolean isLegal(char[] sequence, int i, int j) {
		return getDinucleotideIndex(sequence, i) >= 0
				&& getDinucleotideIndex(sequence, j) >= 0;
	}

	public int getScore(char[] sequence, int i, int j) {
		int indexI = getDinucleotideIndex(sequence, i);
		int indexJ = getDinucleotideIndex(sequence, j);

		if (indexI < 0 || indexJ < 0)
			return 0;

		return matrix.getScore(indexI, indexJ);
	}

	public StructureRenderer getRenderer() {
		return renderer;
	}

	public String toString() {
		return "StackedPairModel[" + name + "]";
	}
}
