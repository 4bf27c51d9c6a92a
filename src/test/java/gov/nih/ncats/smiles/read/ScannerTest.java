package gov.nih.ncats.smiles.read;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

import org.junit.Test;

import gov.nih.ncats.smiles.SmilesSyntaxException;
import gov.nih.ncats.smiles.feature.AtomKind;
import gov.nih.ncats.smiles.feature.Element;

public class ScannerTest {

	@Test
	public void classifiesEachTerminal(){
		assertEquals(Terminal.ATOM, new Scanner("C").peekTerminal());
		assertEquals(Terminal.ATOM, new Scanner("c").peekTerminal());
		assertEquals(Terminal.ATOM, new Scanner("*").peekTerminal());
		assertEquals(Terminal.ATOM, new Scanner("Br").peekTerminal());
		assertEquals(Terminal.BRACKET_OPEN, new Scanner("[").peekTerminal());
		assertEquals(Terminal.BOND, new Scanner("\\").peekTerminal());
		assertEquals(Terminal.RING_BOND, new Scanner("7").peekTerminal());
		assertEquals(Terminal.RING_BOND, new Scanner("%12").peekTerminal());
		assertEquals(Terminal.BRANCH_OPEN, new Scanner("(").peekTerminal());
		assertEquals(Terminal.BRANCH_CLOSE, new Scanner(")").peekTerminal());
		assertEquals(Terminal.DOT, new Scanner(".").peekTerminal());
		assertEquals(Terminal.END, new Scanner("").peekTerminal());
		assertEquals(Terminal.INVALID, new Scanner("X").peekTerminal());
		assertEquals(Terminal.INVALID, new Scanner("]").peekTerminal());
		assertEquals(Terminal.INVALID, new Scanner("A").peekTerminal());
	}

	@Test
	public void twoLetterOrganicSymbolsAreGreedy() throws Exception{
		Scanner s = new Scanner("ClC");
		assertEquals(AtomKind.aliphatic(Element.Cl), s.readUnbracketedAtom());
		assertEquals(2, s.getCursor());
		assertEquals(AtomKind.aliphatic(Element.C), s.readUnbracketedAtom());
		assertEquals(Terminal.END, s.peekTerminal());
	}

	@Test
	public void sulfurFollowedByAromaticCarbonIsNotScandium() throws Exception{
		Scanner s = new Scanner("Sc");
		assertEquals(AtomKind.aliphatic(Element.S), s.readUnbracketedAtom());
		assertEquals(AtomKind.aromatic(Element.C), s.readUnbracketedAtom());
	}

	@Test
	public void ringNumbersReadOneDigitOrPercentTwo() throws Exception{
		Scanner s = new Scanner("3%45");
		assertEquals(3, s.readRingNumber());
		assertEquals(45, s.readRingNumber());
		assertEquals(4, s.getCursor());
	}

	@Test
	public void percentNeedsTwoDigits(){
		try{
			new Scanner("%1N").readRingNumber();
			fail("expected failure");
		}catch(SmilesSyntaxException e){
			assertEquals(SmilesSyntaxException.Reason.INVALID_CHARACTER, e.getReason());
			assertEquals(2, e.getCursor());
		}
	}

	@Test
	public void runningOutOfTextReportsTheLength(){
		try{
			new Scanner("%1").readRingNumber();
			fail("expected failure");
		}catch(SmilesSyntaxException e){
			assertEquals(SmilesSyntaxException.Reason.END_OF_INPUT, e.getReason());
			assertEquals(2, e.getCursor());
		}
	}

	@Test
	public void readNumberStopsAtLimit(){
		Scanner s = new Scanner("12345");
		assertEquals(123, s.readNumber(3).getAsInt());
		assertEquals(3, s.getCursor());
		assertFalse(new Scanner("x").readNumber(3).isPresent());
	}
}
