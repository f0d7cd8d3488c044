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

package uk.ac.sanger.rnafold.io;

import java.io.PrintStream;

import uk.ac.sanger.rnafold.nussinov.FoldingResult;
import uk.ac.sanger.rnafold.nussinov.FoldingTableModel;

public class TablePrinter {
	private static final int NOT_CALCULATED = -1;

	public void print(FoldingResult result, PrintStream ps) {
		ps.println("Printing DP-Table:");
		printTable(result.getTable(), ps);

		ps.println("Printing sequence:");
		ps.println(result.getSequence());

		if (result.hasAnnotation()) {
			ps.println("Printing output:");
			ps.println(result.getAnnotation());
		}
	}

	/**
	 * Prints one line per row. Cells below the sub-diagonal are never
	 * calculated and print as -1.
	 */
	public void printTable(FoldingTableModel table, PrintStream ps) {
		int size = table.getSize();

		for (int row = 0; row < size; row++) {
			StringBuilder sb = new StringBuilder("[");

			for (int col = 0; col < size; col++) {
				if (col > 0)
					sb.append(", ");

				int value = col >= row - 1 ? table.getScore(row, col) : NOT_CALCULATED;

				sb.append(value);
			}

			sb.append("]");

			ps.println(sb.toString());
		}
	}
}
