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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

public class PairingModels {
	public static final String FLAT = "flat";
	public static final String ENERGY = "energy";
	public static final String STACKED = "stacked";

	public static final String MODEL_PROPERTY_PREFIX = "rnafold.model.";
	public static final String PAIRS_SUFFIX = ".pairs";
	public static final String STACKING_SUFFIX = ".stacking";

	private static final PairingModel FLAT_MODEL = new BasePairModel(FLAT,
			BasePairTable.WATSON_CRICK);

	private static final PairingModel ENERGY_MODEL = new BasePairModel(ENERGY,
			BasePairTable.WATSON_CRICK_ENERGY);

	private static final PairingModel STACKED_MODEL = new StackedPairModel(
			STACKED, StackingMatrix.UNIFORM);

	public static PairingModel flat() {
		return FLAT_MODEL;
	}

	public static PairingModel energy() {
		return ENERGY_MODEL;
	}

	public static PairingModel stacked() {
		return STACKED_MODEL;
	}

	public static boolean isBuiltIn(String name) {
		return name != null
				&& (name.equalsIgnoreCase(FLAT) || name.equalsIgnoreCase(ENERGY) || name
						.equalsIgnoreCase(STACKED));
	}

	public static PairingModel forName(String name) {
		if (name == null)
			throw new IllegalArgumentException("No pairing model name was given");

		if (name.equalsIgnoreCase(FLAT))
			return FLAT_MODEL;
		else if (name.equalsIgnoreCase(ENERGY))
			return ENERGY_MODEL;
		else if (name.equalsIgnoreCase(STACKED))
			return STACKED_MODEL;
		else
			throw new IllegalArgumentException("Unknown pairing model: " + name);
	}

	/**
	 * Resolves a model name against the built-in models and then against the
	 * custom models defined in the properties, either as
	 * <code>rnafold.model.NAME.pairs=AU:2,UA:2,...</code> or as
	 * <code>rnafold.model.NAME.stacking=</code> followed by the 36 entries of
	 * the stacking matrix in row order.
	 */
	public static PairingModel fromProperties(Properties props, String name) {
		if (isBuiltIn(name))
			return forName(name);

		if (name == null)
			throw new IllegalArgumentException("No pairing model name was given");

		String pairs = props.getProperty(MODEL_PROPERTY_PREFIX + name + PAIRS_SUFFIX);

		if (pairs != null)
			return new BasePairModel(name, parsePairs(pairs));

		String stacking = props.getProperty(MODEL_PROPERTY_PREFIX + name
				+ STACKING_SUFFIX);

		if (stacking != null)
			return new StackedPairModel(name, parseStacking(stacking));

		throw new IllegalArgumentException("Unknown pairing model: " + name);
	}

	public static BasePairTable parsePairs(String text) {
		Map<String, Integer> pairs = new LinkedHashMap<String, Integer>();

		String[] words = text.trim().split("\\s*,\\s*");

		for (int i = 0; i < words.length; i++) {
			String[] parts = words[i].split("\\s*:\\s*");

			if (parts.length != 2)
				throw new IllegalArgumentException("Expected PAIR:SCORE but found \""
						+ words[i] + "\"");

			pairs.put(parts[0].toUpperCase(), parseInteger(parts[1]));
		}

		return new BasePairTable(pairs);
	}

	public static StackingMatrix parseStacking(String text) {
		String[] words = text.trim().split("\\s*,\\s*");

		int size = StackingMatrix.DEFAULT_DINUCLEOTIDES.length;

		if (words.length != size * size)
			throw new IllegalArgumentException("Expected " + (size * size)
					+ " stacking scores but found " + words.length);

		int[][] matrix = new int[size][size];

		for (int i = 0; i < words.length; i++)
			matrix[i / size][i % size] = parseInteger(words[i]);

		return new StackingMatrix(StackingMatrix.DEFAULT_DINUCLEOTIDES, matrix);
	}

	private static int parseInteger(String word) {
		try {
			return Integer.parseInt(word.trim());
		} catch (NumberFormatException nfe) {
			throw new IllegalArgumentException("Not an integer score: \"" + word
					+ "\"", nfe);
		}
	}
}
