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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;

import uk.ac.sanger.rnafold.RnaFold;
import uk.ac.sanger.rnafold.pairing.PairingModel;
import uk.ac.sanger.rnafold.structure.BasePair;

/**
 * Nussinov maximal pairing. The table cell (i, j) holds the best score of
 * any non-crossing set of legal pairs within positions i to j, where a pair
 * (i, j) also requires j - i &gt; gap:
 *
 * <pre>
 * table[i][j] = max(score(i, j) + table[i+1][j-1]   if (i, j) may pair,
 *                   table[i+1][j],
 *                   table[i][j-1],
 *                   max over i &lt;= k &lt; j of table[i][k] + table[k+1][j])
 * </pre>
 */
public class NussinovFolder {
	public static FoldingTableModel calculateTable(char[] sequence,
			PairingModel model, int gap) {
		SimpleFoldingTable table = new SimpleFoldingTable(sequence, model, gap);

		char[] bases = table.getSequence();
		int size = table.getSize();

		// Fill by increasing distance from the diagonal, so that every cell
		// which a cell depends upon has already been calculated.
		for (int distance = 1; distance < size; distance++) {
			if (distance <= gap)
				continue;

			for (int row = 0; row + distance < size; row++) {
				int col = row + distance;

				table.setScore(row, col, bestScore(table, bases, model, row, col));
			}
		}

		table.setFilled();

		if (RnaFold.isLoggable(Level.FINE))
			RnaFold.logFine("Filled a " + size + "x" + size + " table using the "
					+ model.getName() + " model with gap " + gap
					+ ", optimal score " + table.getOptimalScore());

		return table;
	}

	public static FoldingTableModel calculateTable(String sequence,
			PairingModel model, int gap) {
		if (sequence == null)
			throw new IllegalArgumentException("Sequence must not be null");

		return calculateTable(sequence.toCharArray(), model, gap);
	}

	private static int bestScore(FoldingTableModel table, char[] bases,
			PairingModel model, int row, int col) {
		int best = max(table.getScore(row + 1, col), table.getScore(row, col - 1));

		if (model.isLegal(bases, row, col))
			best = max(best, model.getScore(bases, row, col)
					+ table.getScore(row + 1, col - 1));

		for (int k = row; k < col; k++)
			best = max(best, table.getScore(row, k) + table.getScore(k + 1, col));

		return best;
	}

	private static int max(int i, int j) {
		return (i > j) ? i : j;
	}

	/**
	 * Recovers one optimal set of pairs from a filled table, in the order in
	 * which a depth-first walk of the intervals finds them. Within an interval
	 * [i, j], position j is left unpaired whenever that preserves the score.
	 * Otherwise j is paired with the smallest k which explains the score, and
	 * failing that the interval is split at the smallest k which does.
	 */
	public static List<BasePair> traceBack(FoldingTableModel table)
			throws FoldingException {
		if (table == null)
			throw new IllegalArgumentException("Table must not be null");

		if (!table.isFilled())
			throw new FoldingException("The table has not been filled", table);

		char[] bases = table.getSequence();
		PairingModel model = table.getPairingModel();
		int gap = table.getGap();

		List<BasePair> pairs = new ArrayList<BasePair>();

		Deque<int[]> intervals = new ArrayDeque<int[]>();

		intervals.push(new int[] { 0, table.getSize() - 1 });

		while (!intervals.isEmpty()) {
			int[] interval = intervals.pop();

			int i = interval[0];
			int j = interval[1];

			if (j <= i)
				continue;

			if (table.getScore(i, j) == table.getScore(i, j - 1)) {
				intervals.push(new int[] { i, j - 1 });
				continue;
			}

			int k = findPartner(table, bases, model, gap, i, j);

			if (k >= 0) {
				pairs.add(new BasePair(k, j));

				// Pushed in reverse, so that [i, k-1] is walked first.
				intervals.push(new int[] { k + 1, j - 1 });
				intervals.push(new int[] { i, k - 1 });
				continue;
			}

			k = findSplit(table, i, j);

			if (k >= 0) {
				intervals.push(new int[] { k + 1, j });
				intervals.push(new int[] { i, k });
			} else
				RnaFold.logWarning("No pair or split explains the score "
						+ table.getScore(i, j) + " of the interval [" + i + ", "
						+ j + "]");
		}

		return pairs;
	}

	private static int findPartner(FoldingTableModel table, char[] bases,
			PairingModel model, int gap, int i, int j) {
		int score = table.getScore(i, j);

		for (int k = i; k < j - gap; k++) {
			if (model.isLegal(bases, k, j)
					&& score == table.getScore(i, k - 1)
							+ table.getScore(k + 1, j - 1)
							+ model.getScore(bases, k, j))
				return k;
		}

		return -1;
	}

	private static int findSplit(FoldingTableModel table, int i, int j) {
		int score = table.getScore(i, j);

		for (int k = i; k < j; k++) {
			if (score == table.getScore(i, k) + table.getScore(k + 1, j))
				return k;
		}

		return -1;
	}
}
