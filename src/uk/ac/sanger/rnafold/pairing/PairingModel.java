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

import uk.ac.sanger.rnafold.structure.StructureRenderer;

/**
 * Decides whether two positions of a sequence may pair, and what the pair
 * contributes to the score of a structure. Implementations are immutable.
 */
public interface PairingModel {
	public String getName();

	public boolean isLegal(char[] sequence, int i, int j);

	/**
	 * Returns the score of pairing position i with position j, or zero if the
	 * pair is not legal.
	 */
	public int getScore(char[] sequence, int i, int j);

	public StructureRenderer getRenderer();
}
