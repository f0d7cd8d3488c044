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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable table of the ordered base pairs which may form, each with the
 * score it contributes. Pairs which are not listed are illegal.
 */
public class BasePairTable {
	public static final int DEFAULT_PAIR_SCORE = 1;
	public static final int DEFAULT_AU_WEIGHT = 2;
	public static final int DEFAULT_GC_WEIGHT = 3;

	private static final int ALPHABET_SIZE = 128;
	private static final int ILLEGAL = -1;

	public static final BasePairTable WATSON_CRICK = watsonCrick(
			DEFAULT_PAIR_SCORE, DEFAULT_PAIR_SCORE);

	public static final BasePairTable WATSON_CRICK_ENERGY = watsonCrick(
			DEFAULT_AU_WEIGHT, DEFAULT_GC_WEIGHT);

	private final int[][] scores = new int[ALPHABET_SIZE][ALPHABET_SIZE];
	private final Map<String, Integer> pairs;

	public BasePairTable(Map<String, Integer> pairs) {
		if (pairs == null)
			throw new IllegalArgumentException("The pair map must not be null");

		for (int i = 0; i < ALPHABET_SIZE; i++)
			Arrays.fill(scores[i], ILLEGAL);

		Map<String, Integer> copy = new LinkedHashMap<String, Integer>();

		for (Map.Entry<String, Integer> entry : pairs.entrySet()) {
			String pair = entry.getKey();
			Integer score = entry.getValue();

			if (pair == null || pair.length() != 2)
				throw new IllegalArgumentException("A base pair must be two symbols, not \""
						+ pair + "\"");

			if (score == null || score.intValue() < 0)
				throw new IllegalArgumentException("The score for " + pair
						+ " must be a non-negative integer");

			char a = pair.charAt(0);
			char b = pair.charAt(1);

			if (a >= ALPHABET_SIZE || b >= ALPHABET_SIZE)
				throw new IllegalArgumentException("Unsupported symbol in base pair " + pair);

			scores[a][b] = score.intValue();
			copy.put(pair, score);
		}

		this.pairs = Collections.unmodifiableMap(copy);
	}

	/**
	 * Builds the table of the four Watson-Crick pairs A-U, U-A, G-C and C-G.
	 */
	public static BasePairTable watsonCrick(int auScore, int gcScore) {
		Map<String, Integer> pairs = new LinkedHashMap<String, Integer>();

		pairs.put("AU", auScore);
		pairs.put("UA", auScore);
		pairs.put("GC", gcScore);
		pairs.put("CG", gcScore);

		return new BasePairTable(pairs);
	}

	public boolean isLegal(char a, char b) {
		return a < ALPHABET_SIZE && b < ALPHABET_SIZE && scores[a][b] != ILLEGAL;
	}

	public int getScore(char a, char b) {
		return isLegal(a, b) ? scores[a][b] : 0;
	}

	public Map<String, Integer> getPairs() {
		return pairs;
	}

	public int size() {
		return pairs.size();
	}

	public String toString() {
		return "BasePairTable" + pairs;
	}
}
