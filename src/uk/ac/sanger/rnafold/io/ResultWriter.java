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

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import uk.ac.sanger.rnafold.nussinov.FoldingResult;
import uk.ac.sanger.rnafold.pairing.StackedPairModel;

/**
 * Writes a result in the results file layout. An annotated
 * result gives the sequence, the annotation and the score, each after a
 * header line; a score-only result gives just the total score. The score is
 * not followed by a newline.
 */
public class ResultWriter {
	public static final String PAIR_COUNT_HEADER = "> max count of pairs";
	public static final String STACKED_SCORE_HEADER = "> max stacked score";
	public static final String TOTAL_SCORE_HEADER = "> total score";

	public void write(FoldingResult result, File file) throws IOException {
		Writer writer = new BufferedWriter(new OutputStreamWriter(
				new FileOutputStream(file), StandardCharsets.US_ASCII));

		try {
			write(result, writer);
		} finally {
			writer.close();
		}
	}

	public void write(FoldingResult result, Writer writer) throws IOException {
		if (result.hasAnnotation()) {
			writer.write("> " + result.getSequence() + "\n");
			writer.write(result.getAnnotation() + "\n");
			writer.write(getScoreHeader(result) + "\n");
		} else
			writer.write(TOTAL_SCORE_HEADER + "\n");

		writer.write(Integer.toString(result.getScore()));
		writer.flush();
	}

	private String getScoreHeader(FoldingResult result) {
		return result.getTable().getPairingModel() instanceof StackedPairModel ? STACKED_SCORE_HEADER
				: PAIR_COUNT_HEADER;
	}
}
