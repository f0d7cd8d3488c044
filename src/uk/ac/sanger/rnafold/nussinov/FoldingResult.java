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

import java.util.Collections;
import java.util.List;

import uk.ac.sanger.rnafold.structure.BasePair;

public class FoldingResult {
	private final String sequence;
	private final String modelName;
	private final int gap;
	private final int score;
	private final List<BasePair> pairs;
	private final String annotation;
	private final FoldingTableModel table;

	public FoldingResult(String sequence, String modelName, int gap, int score,
			List<BasePair> pairs, String annotation, FoldingTableModel table) {
		this.sequence = sequence;
		this.modelName = modelName;
		this.gap = gap;
		this.score = score;
		this.pairs = Collections.unmodifiableList(pairs);
		this.annotation = annotation;
		this.table = table;
	}

	public String getSequence() {
		return sequence;
	}

	public String getModelName() {
		return modelName;
	}

	public int getGap() {
		return gap;
	}

	public int getScore() {
		return score;
	}

	public List<BasePair> getPairs() {
		return pairs;
	}

	public boolean hasAnnotation() {
		return annotation != null;
	}

	/**
	 * Returns the bracket annotation, or null if the result was produced in
	 * score-only mode.
	 */
	public String getAnnotation() {
		return annotation;
	}

	public FoldingTableModel getTable() {
		return table;
	}

	public String toString() {
		return "FoldingResult[model=" + modelName + ", gap=" + gap + ", score="
				+ score + ", pairs=" + pairs.size()
				+ (annotation == null ? "" : ", annotation=" + annotation) + "]";
	}
}
