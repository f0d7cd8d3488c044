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

import static org.junit.Assert.*;

import java.util.Properties;

import org.junit.Test;

public class PairingModelsTest {
	@Test
	public void testBuiltInModels() {
		assertSame(PairingModels.flat(), PairingModels.forName("flat"));
		assertSame(PairingModels.energy(), PairingModels.forName("ENERGY"));
		assertSame(PairingModels.stacked(), PairingModels.forName("Stacked"));

		assertEquals("flat", PairingModels.flat().getName());
		assertEquals("energy", PairingModels.energy().getName());
		assertEquals("stacked", PairingModels.stacked().getName());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownModel() {
		PairingModels.forName("zuker");
	}

	@Test
	public void testBuiltInModelWinsOverProperties() {
		Properties props = new Properties();
		props.setProperty("rnafold.model.flat.pairs", "GU:1");

		assertSame(PairingModels.flat(), PairingModels.fromProperties(props, "flat"));
	}

	@Test
	public void testCustomPairsFromProperties() {
		Properties props = new Properties();
		props.setProperty("rnafold.model.wobble.pairs",
				"AU:2, UA:2, GC:3, CG:3, gu:1, UG:1");

		PairingModel model = PairingModels.fromProperties(props, "wobble");

		assertTrue(model instanceof BasePairModel);
		assertEquals("wobble", model.getName());

		BasePairTable table = ((BasePairModel) model).getTable();

		assertEquals(6, table.size());
		assertEquals(1, table.getScore('G', 'U'));
		assertEquals(3, table.getScore('C', 'G'));
	}

	@Test
	public void testCustomStackingFromProperties() {
		StringBuilder sb = new StringBuilder();

		for (int i = 0; i < 36; i++) {
			if (i > 0)
				sb.append(',');

			sb.append(i / 6 == i % 6 ? 2 : 1);
		}

		Properties props = new Properties();
		props.setProperty("rnafold.model.diagonal.stacking", sb.toString());

		PairingModel model = PairingModels.fromProperties(props, "diagonal");

		assertTrue(model instanceof StackedPairModel);

		StackingMatrix matrix = ((StackedPairModel) model).getMatrix();

		assertEquals(2, matrix.getScore(3, 3));
		assertEquals(1, matrix.getScore(3, 4));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUndefinedCustomModel() {
		PairingModels.fromProperties(new Properties(), "missing");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMalformedPairs() {
		PairingModels.parsePairs("AU=2");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonNumericScore() {
		PairingModels.parsePairs("AU:two");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testShortStackingMatrix() {
		PairingModels.parseStacking("1,1,1");
	}
}
