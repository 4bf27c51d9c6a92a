package gov.nih.ncats.smiles.feature;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class AtomKindTest {

	@Test
	public void unbracketedKindsPrintTheirSymbol(){
		assertEquals("*", AtomKind.star().toString());
		assertEquals("Cl", AtomKind.aliphatic(Element.Cl).toString());
		assertEquals("c", AtomKind.aromatic(Element.C).toString());
	}

	@Test
	public void bracketPrintsEveryFeatureInOrder(){
		AtomKind k = AtomKind.bracket(Element.C)
				.isotope(13)
				.configuration(Configuration.TH2)
				.hcount(3)
				.charge(1)
				.map(2)
				.build();
		assertEquals("[13C@@H3+:2]", k.toString());
	}

	@Test
	public void onlyTetrahedralMarkersInvert(){
		AtomKind th1 = AtomKind.bracket(Element.C).configuration(Configuration.TH1).hcount(1).build();
		assertEquals("[C@@H]", th1.invertConfiguration().toString());
		assertEquals(th1, th1.invertConfiguration().invertConfiguration());
		AtomKind tb = AtomKind.bracket(Element.As).configuration(Configuration.TB5).build();
		assertEquals(tb, tb.invertConfiguration());
		AtomKind plain = AtomKind.aliphatic(Element.C);
		assertEquals(plain, plain.invertConfiguration());
		assertEquals(Configuration.AL1, Configuration.AL1.invert());
	}

	@Test
	public void singleHydrogenAndUnitChargeHaveNoCount(){
		assertEquals("[NH+]", AtomKind.bracket(Element.N).hcount(1).charge(1).build().toString());
		assertEquals("[O-]", AtomKind.bracket(Element.O).charge(-1).build().toString());
	}

	@Test
	public void zeroCountsAreStillWritten(){
		assertEquals("[CH0+0]", AtomKind.bracket(Element.C).hcount(0).charge(0).build().toString());
	}

	@Test
	public void bracketAromaticAndStarForms(){
		assertEquals("[se]", AtomKind.bracket(Element.Se).aromatic(true).build().toString());
		assertEquals("[*]", AtomKind.bracketStar().build().toString());
		assertTrue(AtomKind.bracketStar().build().isStar());
		assertTrue(AtomKind.bracketStar().build().isBracket());
	}

	@Test(expected = IllegalArgumentException.class)
	public void ironCanNotBeWrittenWithoutBrackets(){
		AtomKind.aliphatic(Element.Fe);
	}

	@Test(expected = IllegalArgumentException.class)
	public void ironHasNoAromaticForm(){
		AtomKind.bracket(Element.Fe).aromatic(true);
	}

	@Test(expected = IllegalArgumentException.class)
	public void chargeIsLimited(){
		AtomKind.bracket(Element.C).charge(16);
	}

	@Test
	public void equalityCoversEveryField(){
		assertEquals(AtomKind.bracket(Element.C).hcount(4).build(), AtomKind.bracket(Element.C).hcount(4).build());
		assertNotEquals(AtomKind.bracket(Element.C).hcount(4).build(), AtomKind.bracket(Element.C).build());
		assertNotEquals(AtomKind.aliphatic(Element.C), AtomKind.bracket(Element.C).build());
		assertFalse(AtomKind.bracket(Element.C).hcount(4).build().hasBracketOnlyFeatures());
		assertTrue(AtomKind.bracket(Element.C).map(1).build().hasBracketOnlyFeatures());
	}
}
