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

package uk.ac.sanger.rnafold.pairing;

import uk.ac.sanger.rnafold.structure.BracketRenderer;
import uk.ac.sanger.rnafold.structure.StructureRenderer;

public class BasePairModel implements PairingModel {
	private final String name;
	private final BasePairTable table;
	private final StructureRenderer renderer = new BracketRenderer();

	public BasePairModel(String name, BasePairTable table) {
		if (name == null || table == null)
			throw new IllegalArgumentException("Name and pair table must not be null");

		this.name = name;
		this.table = table;
	}

	public String getName() {
		return name;
	}

	public BasePairTable getTable() {
		return table;
	}

	public boolean isLegal(char[] sequence, int i, int j) {
		if (i < 0 || j < 0 || i >= sequence.length || j >= sequence.length)
			return false;

		return table.isLegal(sequence[i], sequence[j]);
	}

	public int getScore(char[] sequence, int i, int j) {
		return isLegal(sequence, i, j) ? table.getScore(sequence[i], sequence[j]) : 0;
	}

	public StructureRenderer getRenderer() {
		return renderer;
	}

	public String toString() {
		return "BasePairModel[" + name + "]";
	}
}
