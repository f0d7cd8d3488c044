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

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

import junit.framework.JUnit4TestAdapter;

import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import uk.ac.sanger.rnafold.pairing.PairingModel;
import uk.ac.sanger.rnafold.pairing.PairingModels;
import uk.ac.sanger.rnafold.structure.StructureRenderer;

public class StructurePredictorTest {
	@Mock private PairingModel model;
	@Mock private StructureRenderer renderer;

	public static junit.framework.Test suite() {
		return new JUnit4TestAdapter(StructurePredictorTest.class);
	}

	@Before
	public void setUp() {
		MockitoAnnotations.initMocks(this);

		when(model.getName()).thenReturn("mock");
		when(model.getRenderer()).thenReturn(renderer);
		when(renderer.render(anyInt(), anyList())).thenReturn("....");
	}

	@Test
	public void testScoreOnlyDoesNotRender() throws FoldingException {
		FoldingResult result = StructurePredictor.predict("ACGU", model, 0,
				OutputMode.SCORE_ONLY);

		verify(renderer, never()).render(anyInt(), anyList());

		assertFalse(result.hasAnnotation());
		assertNull(result.getAnnotation());
		assertEquals(0, result.getScore());
		assertEquals("mock", result.getModelName());
	}

	@Test
	public void testAnnotatedRendersOnce() throws FoldingException {
		FoldingResult result = StructurePredictor.predict("ACGU", model, 0,
				OutputMode.ANNOTATED);

		verify(renderer, times(1)).render(eq(4), anyList());

		assertTrue(result.hasAnnotation());
		assertEquals("....", result.getAnnotation());
	}

	@Test
	public void testModelIsConsultedForEveryCandidatePair()
			throws FoldingException {
		StructurePredictor.predict("ACGU", model, 1, OutputMode.SCORE_ONLY);

		verify(model).isLegal(any(char[].class), eq(0), eq(3));
		verify(model).isLegal(any(char[].class), eq(0), eq(2));
		verify(model, never()).isLegal(any(char[].class), eq(0), eq(1));
	}

	@Test
	public void testScenarios() throws FoldingException {
		FoldingResult result = StructurePredictor.predict("GCACG",
				PairingModels.flat(), 0);

		assertEquals(2, result.getScore());
		assertEquals("{}.{}", result.getAnnotation());

		result = StructurePredictor.predict("GCACG", PairingModels.flat(), 1);

		assertEquals(1, result.getScore());
		assertEquals("{..}.", result.getAnnotation());

		result = StructurePredictor.predict("AUGC", PairingModels.energy(), 0);

		assertEquals(5, result.getScore());
		assertEquals("{}{}", result.getAnnotation());

		result = StructurePredictor.predict("", PairingModels.flat(), 0);

		assertEquals(0, result.getScore());
		assertEquals("", result.getAnnotation());

		result = StructurePredictor.predict("GCGC", PairingModels.stacked(), 0);

		assertEquals(1, result.getScore());
		assertEquals("{{}.", result.getAnnotation());
	}

	@Test
	public void testStackedAnnotations() throws FoldingException {
		assertEquals("{{{}}}", StructurePredictor.predict("AUGCAU",
				PairingModels.stacked(), 0).getAnnotation());
		assertEquals("{{{{}}", StructurePredictor.predict("GCAUGC",
				PairingModels.stacked(), 0).getAnnotation());
		assertEquals("{{{}}.", StructurePredictor.predict("GCGCGC",
				PairingModels.stacked(), 0).getAnnotation());
		assertEquals(".........", StructurePredictor.predict("GGGAAAUCC",
				PairingModels.stacked(), 0).getAnnotation());
	}

	@Test
	public void testPairsAreUnmodifiable() throws FoldingException {
		FoldingResult result = StructurePredictor.predict("AU",
				PairingModels.flat(), 0);

		assertEquals(1, result.getPairs().size());

		try {
			result.getPairs().clear();
			fail("The pair list should be unmodifiable");
		} catch (UnsupportedOperationException uoe) {
			assertEquals(1, result.getPairs().size());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullMode() throws FoldingException {
		StructurePredictor.predict("AU", PairingModels.flat(), 0, null);
	}
}
