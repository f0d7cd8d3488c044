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

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import org.junit.Test;

import uk.ac.sanger.rnafold.nussinov.FoldingException;
import uk.ac.sanger.rnafold.nussinov.FoldingResult;
import uk.ac.sanger.rnafold.nussinov.OutputMode;
import uk.ac.sanger.rnafold.nussinov.StructurePredictor;
import uk.ac.sanger.rnafold.pairing.PairingModels;

public class TablePrinterTest {
	private String print(FoldingResult result) {
		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		PrintStream ps = new PrintStream(baos, true);

		new TablePrinter().print(result, ps);

		ps.close();

		return baos.toString().replace(System.lineSeparator(), "\n");
	}

	@Test
	public void testAnnotatedResult() throws FoldingException {
		FoldingResult result = StructurePredictor.predict("GCACG",
				PairingModels.flat(), 0);

		String expected = "Printing DP-Table:\n" + "[0, 1, 1, 1, 2]\n"
				+ "[0, 0, 0, 0, 1]\n" + "[-1, 0, 0, 0, 1]\n"
				+ "[-1, -1, 0, 0, 1]\n" + "[-1, -1, -1, 0, 0]\n"
				+ "Printing sequence:\n" + "GCACG\n" + "Printing output:\n"
				+ "{}.{}\n";

		assertEquals(expected, print(result));
	}

	@Test
	public void testScoreOnlyResultHasNoOutputSection() throws FoldingException {
		FoldingResult result = StructurePredictor.predict("GCGC",
				PairingModels.stacked(), 0, OutputMode.SCORE_ONLY);

		String expected = "Printing DP-Table:\n" + "[0, 1, 1, 1]\n"
				+ "[0, 0, 1, 1]\n" + "[-1, 0, 0, 0]\n" + "[-1, -1, 0, 0]\n"
				+ "Printing sequence:\n" + "GCGC\n";

		assertEquals(expected, print(result));
	}
}
