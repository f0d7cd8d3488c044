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

public interface FoldingTableModel {
	public int getSize();

	public char[] getSequence();

	public PairingModel getPairingModel();

	public int getGap();

	/**
	 * True for the cells (row, column) with 0 &lt;= row &lt;= column &lt; size,
	 * which are the only cells held by the table.
	 */
	public boolean exists(int row, int column);

	/**
	 * Returns the score of the interval [row, column], or zero for any cell
	 * which does not exist, including empty intervals and negative indices.
	 */
	public int getScore(int row, int column);

	public void setScore(int row, int column, int score);

	public boolean isFilled();

	public void setFilled();

	public int getOptimalScore();
}
