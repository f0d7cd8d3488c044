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

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import uk.ac.sanger.rnafold.nussinov.FoldingException;
import uk.ac.sanger.rnafold.nussinov.FoldingResult;
import uk.ac.sanger.rnafold.nussinov.OutputMode;
import uk.ac.sanger.rnafold.nussinov.StructurePredictor;
import uk.ac.sanger.rnafold.pairing.PairingModels;

public class ResultWriterTest {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final ResultWriter writer = new ResultWriter();

	private String write(FoldingResult result) throws IOException {
		StringWriter sw = new StringWriter();
		writer.write(result, sw);
		return sw.toString();
	}

	@Test
	public void testAnnotatedBasePairResult() throws IOException,
			FoldingException {
		FoldingResult result = StructurePredictor.predict("GCACG",
				PairingModels.flat(), 0);

		assertEquals("> GCACG\n{}.{}\n> max count of pairs\n2", write(result));
	}

	@Test
	public void testAnnotatedStackedResult() throws IOException,
			FoldingException {
		FoldingResult result = StructurePredictor.predict("GCGC",
				PairingModels.stacked(), 0);

		assertEquals("> GCGC\n{{}.\n> max stacked score\n1", write(result));
	}

	@Test
	public void testScoreOnlyResult() throws IOException, FoldingException {
		FoldingResult result = StructurePredictor.predict("AUGC",
				PairingModels.energy(), 0, OutputMode.SCORE_ONLY);

		assertEquals("> total score\n5", write(result));
	}

	@Test
	public void testEmptySequence() throws IOException, FoldingException {
		FoldingResult result = StructurePredictor.predict("",
				PairingModels.flat(), 0);

		assertEquals("> \n\n> max count of pairs\n0", write(result));
	}

	@Test
	public void testWriteToFile() throws IOException, FoldingException {
		File file = new File(folder.getRoot(), "output.txt");

		writer.write(StructurePredictor.predict("GCACG", PairingModels.flat(), 1),
				file);

		String content = new String(Files.readAllBytes(file.toPath()),
				StandardCharsets.US_ASCII);

		assertEquals("> GCACG\n{..}.\n> max count of pairs\n1", content);
	}
}
