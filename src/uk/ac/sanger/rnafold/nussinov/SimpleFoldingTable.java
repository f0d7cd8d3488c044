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

package uk.ac.sanger.rnafold.nussinov;

import uk.ac.sanger.rnafold.pairing.PairingModel;

public class SimpleFoldingTable implements FoldingTableModel {
	private final int table[][];

	private final char[] sequence;
	private final PairingModel model;
	private final int gap;

	private boolean filled = false;

	public SimpleFoldingTable(char[] sequence, PairingModel model, int gap) {
		if (sequence == null || model == null)
			throw new IllegalArgumentException("Sequence and pairing model must not be null");

		if (gap < 0)
			throw new IllegalArgumentException("The gap must not be negative: " + gap);

		this.sequence = sequence.clone();
		this.model = model;
		this.gap = gap;

		int size = sequence.length;

		table = new int[size][size];
	}

	public int getSize() {
		return sequence.length;
	}

	public char[] getSequence() {
		return sequence.clone();
	}

	public PairingModel getPairingModel() {
		return model;
	}

	public int getGap() {
		return gap;
	}

	public boolean exists(int row, int column) {
		return row >= 0 && row <= column && column < sequence.length;
	}

	public int getScore(int row, int column) {
		if (exists(row, column))
			return table[row][column];
		else
			return 0;
	}

	public void setScore(int row, int column, int score) {
		if (filled)
			throw new IllegalStateException("The table has already been filled");

		if (!exists(row, column))
			throw new IllegalArgumentException("No such cell (" + row + ", "
					+ column + ") in a table of size " + sequence.length);

		table[row][column] = score;
	}

	public boolean isFilled() {
		return filled;
	}

	public void setFilled() {
		filled = true;
	}

	public int getOptimalScore() {
		return sequence.length == 0 ? 0 : table[0][sequence.length - 1];
	}
}
