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

import java.util.Arrays;

/**
 * The legal dinucleotides of the stacked-pair model, each with an index into
 * a symmetric matrix of stacking scores.
 */
public class StackingMatrix {
	public static final String[] DEFAULT_DINUCLEOTIDES = { "AU", "UA", "GC",
			"CG", "GU", "UG" };

	public static final int DEFAULT_STACKING_SCORE = 1;

	private static final int ALPHABET_SIZE = 128;
	private static final int NOT_LEGAL = -1;

	public static final StackingMatrix UNIFORM = uniform(DEFAULT_STACKING_SCORE);

	private final String[] dinucleotides;
	private final int[][] matrix;
	private final int[] indices = new int[ALPHABET_SIZE * ALPHABET_SIZE];

	public StackingMatrix(String[] dinucleotides, int[][] matrix) {
		if (dinucleotides == null || matrix == null)
			throw new IllegalArgumentException("Dinucleotides and matrix must not be null");

		int size = dinucleotides.length;

		if (matrix.length != size)
			throw new IllegalArgumentException("Expected a " + size + "x" + size
					+ " matrix but found " + matrix.length + " rows");

		Arrays.fill(indices, NOT_LEGAL);

		for (int i = 0; i < size; i++) {
			String dinucleotide = dinucleotides[i];

			if (dinucleotide == null || dinucleotide.length() != 2)
				throw new IllegalArgumentException("A dinucleotide must be two symbols, not \""
						+ dinucleotide + "\"");

			char a = dinucleotide.charAt(0);
			char b = dinucleotide.charAt(1);

			if (a >= ALPHABET_SIZE || b >= ALPHABET_SIZE)
				throw new IllegalArgumentException("Unsupported symbol in dinucleotide "
						+ dinucleotide);

			if (indices[a * ALPHABET_SIZE + b] != NOT_LEGAL)
				throw new IllegalArgumentException("Duplicate dinucleotide " + dinucleotide);

			indices[a * ALPHABET_SIZE + b] = i;
		}

		this.matrix = new int[size][];

		for (int row = 0; row < size; row++) {
			if (matrix[row] == null || matrix[row].length != size)
				throw new IllegalArgumentException("Row " + row + " of the stacking matrix must have "
						+ size + " entries");

			this.matrix[row] = matrix[row].clone();
		}

		for (int row = 0; row < size; row++)
			for (int col = row + 1; col < size; col++)
				if (this.matrix[row][col] != this.matrix[col][row])
					throw new IllegalArgumentException("The stacking matrix is not symmetric at ("
							+ row + ", " + col + ")");

		this.dinucleotides = dinucleotides.clone();
	}

	public static StackingMatrix uniform(int score) {
		int size = DEFAULT_DINUCLEOTIDES.length;

		int[][] matrix = new int[size][size];

		for (int row = 0; row < size; row++)
			Arrays.fill(matrix[row], score);

		return new StackingMatrix(DEFAULT_DINUCLEOTIDES, matrix);
	}

	/**
	 * Returns the index of the dinucleotide (a, b), or -1 if it is not one of
	 * the legal dinucleotides.
	 */
	public int getIndex(char a, char b) {
		if (a >= ALPHABET_SIZE || b >= ALPHABET_SIZE)
			return NOT_LEGAL;

		return indices[a * ALPHABET_SIZE + b];
	}

	public boolean isLegal(char a, char b) {
		return getIndex(a, b) != NOT_LEGAL;
	}

	public int getScore(int indexA, int indexB) {
		return matrix[indexA][indexB];
	}

	public int getSize() {
		return dinucleotides.length;
	}

	public String[] getDinucleotides() {
		return dinucleotides.clone();
	}

	public String toString() {
		return "StackingMatrix" + Arrays.toString(dinucleotides);
	}
}
