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

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class SequenceFileReaderTest {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final SequenceFileReader reader = new SequenceFileReader();

	private String read(String text) throws IOException {
		return reader.readSequence(new ByteArrayInputStream(text
				.getBytes(StandardCharsets.US_ASCII)));
	}

	@Test
	public void testPlainSequence() throws IOException {
		assertEquals("GGGAAAUCC", read("GGGAAAUCC\n"));
		assertEquals("GGGAAAUCC", read("GGGAAAUCC"));
		assertEquals("GGGAAAUCC", read("GGGAAAUCC\r\nIGNORED\n"));
	}

	@Test
	public void testLeadingBlankLinesAreSkipped() throws IOException {
		assertEquals("AUGC", read("\n   \nAUGC\n"));
	}

	@Test
	public void testEmptyFile() throws IOException {
		assertEquals("", read(""));
		assertEquals("", read("\n\n"));
	}

	@Test
	public void testFastaRecord() throws IOException {
		String fasta = ">seq1 test hairpin\nGGGAA\n AUCC \n>seq2\nAUAU\n";

		assertEquals("GGGAAAUCC", read(fasta));
	}

	@Test
	public void testFastaWithoutResidues() throws IOException {
		assertEquals("", read(">empty\n"));
	}

	@Test
	public void testReadFromFile() throws IOException {
		File file = folder.newFile("sequence.txt");

		FileOutputStream fos = new FileOutputStream(file);
		fos.write("GCACG\n".getBytes(StandardCharsets.US_ASCII));
		fos.close();

		assertEquals("GCACG", reader.readSequence(file));
	}

	@Test(expected = FileNotFoundException.class)
	public void testMissingFile() throws IOException {
		reader.readSequence(new File(folder.getRoot(), "missing.txt"));
	}
}
