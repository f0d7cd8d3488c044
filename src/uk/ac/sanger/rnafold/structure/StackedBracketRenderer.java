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

import java.util.Arrays;
import java.util.List;

/**
 * Renders pairs of dinucleotides. A pair (k, j) covers positions k and k+1
 * on the opening side and j and j+1 on the closing side: k is always opened
 * and j+1 always closed, whilst k+1 is opened and j closed only if no earlier
 * pair has marked them.
 */
public class StackedBracketRenderer implements StructureRenderer {
	public String render(int length, List<BasePair> pairs) {
		char[] output = new char[length];

		Arrays.fill(output, UNPAIRED);

		for (BasePair pair : pairs) {
			int k = pair.getLeft();
			int j = pair.getRight();

			output[k] = OPEN;

			if (k + 1 < length && output[k + 1] == UNPAIRED)
				output[k + 1] = OPEN;

			if (output[j] == UNPAIRED)
				output[j] = CLOSE;

			if (j + 1 < length)
				output[j + 1] = CLOSE;
		}

		return new String(output);
	}
}
