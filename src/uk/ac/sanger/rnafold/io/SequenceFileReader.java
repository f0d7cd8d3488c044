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

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Reads the sequence to be folded. A plain file holds the sequence on its
 * first non-blank line. A FASTA file, recognised by a first non-blank line
 * starting with '&gt;', holds it in the residue lines of its first record.
 */
public class SequenceFileReader {
	private static final String FASTA_PREFIX = ">";

	public String readSequence(File file) throws IOException {
		InputStream is = new FileInputStream(file);

		try {
			return readSequence(is);
		} finally {
			is.close();
		}
	}

	public String readSequence(InputStream is) throws IOException {
		BufferedReader br = new BufferedReader(new InputStreamReader(is,
				StandardCharsets.US_ASCII));

		String line = br.readLine();

		while (line != null && line.trim().length() == 0)
			line = br.readLine();

		if (line == null)
			return "";

		if (!line.startsWith(FASTA_PREFIX))
			return line;

		StringBuilder sb = new StringBuilder();

		while ((line = br.readLine()) != null) {
			if (line.startsWith(FASTA_PREFIX))
				break;

			sb.append(line.trim());
		}

		return sb.toString();
	}
}
