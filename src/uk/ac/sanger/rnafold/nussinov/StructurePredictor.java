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

import java.util.List;

import uk.ac.sanger.rnafold.RnaFold;
import uk.ac.sanger.rnafold.pairing.PairingModel;
import uk.ac.sanger.rnafold.structure.BasePair;

public class StructurePredictor {
	public static FoldingResult predict(String sequence, PairingModel model,
			int gap, OutputMode mode) throws FoldingException {
		if (mode == null)
			throw new IllegalArgumentException("Output mode must not be null");

		FoldingTableModel table = NussinovFolder.calculateTable(sequence, model,
				gap);

		List<BasePair> pairs = NussinovFolder.traceBack(table);

		String annotation = mode == OutputMode.ANNOTATED ? model.getRenderer()
				.render(table.getSize(), pairs) : null;

		FoldingResult result = new FoldingResult(sequence, model.getName(), gap,
				table.getOptimalScore(), pairs, annotation, table);

		RnaFold.logFine("Predicted " + result);

		return result;
	}

	public static FoldingResult predict(String sequence, PairingModel model,
			int gap) throws FoldingException {
		return predict(sequence, model, gap, OutputMode.ANNOTATED);
	}
}
