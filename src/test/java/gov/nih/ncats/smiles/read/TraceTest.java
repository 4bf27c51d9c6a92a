package gov.nih.ncats.smiles.read;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import gov.nih.ncats.smiles.SmilesSyntaxException;

public class TraceTest {

	private static Trace trace(String smiles) throws Exception{
		Trace trace = new Trace();
		SmilesParser.parse(smiles, trace);
		return trace;
	}

	@Test
	public void everyAtomMapsBackToItsToken() throws Exception{
		String smiles = "[13CH3]C(Cl)c1ccccc1Br";
		Trace trace = trace(smiles);
		List<String> expected = Arrays.asList("[13CH3]","C","Cl","c","c","c","c","c","c","Br");
		assertEquals(expected.size(), trace.getAtomCount());
		for(int i=0;i<expected.size();i++){
			assertEquals(expected.get(i), trace.atom(i).get().of(smiles));
		}
		assertFalse(trace.atom(expected.size()).isPresent());
	}

	@Test
	public void chainBondHasOneIdBothWays() throws Exception{
		Trace trace = trace("C=C");
		assertEquals(0, trace.bondId(0, 1).getAsInt());
		assertEquals(0, trace.bondId(1, 0).getAsInt());
		assertEquals(1, trace.bond(0).getAsInt());
	}

	@Test
	public void elidedBondPointsAtTheNextAtom() throws Exception{
		Trace trace = trace("CC(O)N");
		assertEquals(1, trace.bond(trace.bondId(0, 1).getAsInt()).getAsInt());
		assertEquals(3, trace.bond(trace.bondId(1, 2).getAsInt()).getAsInt());
		assertEquals(5, trace.bond(trace.bondId(1, 3).getAsInt()).getAsInt());
		assertFalse(trace.bondId(0, 2).isPresent());
	}

	@Test
	public void ringClosureHasOneIdPerEnd() throws Exception{
		Trace trace = trace("C1CCCCC1");
		assertEquals(7, trace.getBondCount());
		int open = trace.bondId(0, 5).getAsInt();
		int close = trace.bondId(5, 0).getAsInt();
		assertEquals(0, open);
		assertEquals(6, close);
		assertEquals(1, trace.bond(open).getAsInt());
		assertEquals(7, trace.bond(close).getAsInt());
	}

	@Test
	public void ringBondWithSymbolPointsAtTheSymbol() throws Exception{
		Trace trace = trace("C=1CCCCC1");
		assertEquals(1, trace.bond(trace.bondId(0, 5).getAsInt()).getAsInt());
	}

	@Test
	public void everyRingNumberTokenIsRecorded() throws Exception{
		String smiles = "C%12CC1CC1C%12";
		Trace trace = trace(smiles);
		assertEquals(4, trace.getRnumCount());
		assertEquals("%12", trace.rnum(0).get().of(smiles));
		assertEquals("1", trace.rnum(1).get().of(smiles));
		assertEquals(CursorRange.of(6, 7), trace.rnum(1).get());
		assertEquals("%12", trace.rnum(3).get().of(smiles));
	}

	@Test
	public void traceIsCompleteAfterParsing() throws Exception{
		assertTrue(trace("CC").isComplete());
	}

	@Test(expected = IllegalStateException.class)
	public void traceCanNotBeReused() throws Exception{
		Trace trace = trace("CC");
		SmilesParser.parse("CC", trace);
	}

	@Test
	public void failedParseLeavesTraceIncomplete() throws Exception{
		Trace trace = new Trace();
		try{
			SmilesParser.parse("CCX", trace);
			fail("expected failure");
		}catch(SmilesSyntaxException e){
			assertFalse(trace.isComplete());
			assertEquals(2, trace.getAtomCount());
		}
	}
}
