package gov.nih.ncats.smiles.graph;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;

import gov.nih.ncats.smiles.feature.AtomKind;
import gov.nih.ncats.smiles.feature.BondKind;
import gov.nih.ncats.smiles.feature.Element;
import gov.nih.ncats.smiles.read.Reading;
import gov.nih.ncats.smiles.read.SmilesParser;
import gov.nih.ncats.smiles.read.Trace;
import gov.nih.ncats.smiles.tree.BranchNode;
import gov.nih.ncats.smiles.tree.RingBond;

public class GraphBuilderTest {

	private static ConnectionTable graph(String smiles) throws Exception{
		Reading r = SmilesParser.parse(smiles);
		return GraphBuilder.fromTree(r.getRoots(), null);
	}

	private static List<Integer> targets(Atom a){
		return a.getBonds().stream().map(Bond::getTarget).collect(Collectors.toList());
	}

	@Test
	public void neighborOrderPlacesTheBracketHydrogenAsWritten() throws Exception{
		ConnectionTable ct = graph("F[C@H](Cl)Br.[C@H](F)(Cl)Br.[C@](F)(Cl)(Br)I");
		assertArrayEquals(new int[]{0,Atom.IMPLICIT_HYDROGEN,1,2}, ct.getAtom(1).getNeighborOrder());
		assertArrayEquals(new int[]{Atom.IMPLICIT_HYDROGEN,0,1,2}, ct.getAtom(4).getNeighborOrder());
		assertArrayEquals(new int[]{0,1,2,3}, ct.getAtom(8).getNeighborOrder());
		assertArrayEquals(new int[]{Atom.IMPLICIT_HYDROGEN}, graph("[CH]").getAtom(0).getNeighborOrder());
		assertArrayEquals(new int[]{0,Atom.IMPLICIT_HYDROGEN}, graph("C[CH]").getAtom(1).getNeighborOrder());
	}

	@Test
	public void cyclohexaneHasSixAtomsAndSixBonds() throws Exception{
		ConnectionTable ct = graph("C1CCCCC1");
		assertEquals(6, ct.getAtomCount());
		assertEquals(6, ct.getBondCount());
		for(Atom a : ct.getAtoms()){
			assertEquals(2, a.getBondCount());
		}
		assertTrue(ct.getAtom(0).connectsTo(5));
	}

	@Test
	public void bondsAreListedInTextOrder() throws Exception{
		ConnectionTable ct = graph("CC(C)C");
		assertEquals("[0, 2, 3]", targets(ct.getAtom(1)).toString());
		ct = graph("C1CCCCC1");
		assertEquals("[5, 1]", targets(ct.getAtom(0)).toString());
		assertEquals("[4, 0]", targets(ct.getAtom(5)).toString());
	}

	@Test
	public void idsFollowTheOrderOfTheText() throws Exception{
		ConnectionTable ct = graph("OC(N)S");
		assertEquals(Element.O, ct.getAtom(0).getKind().getElement().get());
		assertEquals(Element.C, ct.getAtom(1).getKind().getElement().get());
		assertEquals(Element.N, ct.getAtom(2).getKind().getElement().get());
		assertEquals(Element.S, ct.getAtom(3).getKind().getElement().get());
	}

	@Test
	public void bothEndsCarryTheBondKind() throws Exception{
		ConnectionTable ct = graph("C#N");
		assertEquals(BondKind.TRIPLE, ct.getAtom(0).getBondTo(1).get().getKind());
		assertEquals(BondKind.TRIPLE, ct.getAtom(1).getBondTo(0).get().getKind());
	}

	@Test
	public void directionalBondIsReversedAtTheFarEnd() throws Exception{
		ConnectionTable ct = graph("F/C=C/F");
		assertEquals(BondKind.UP, ct.getAtom(0).getBondTo(1).get().getKind());
		assertEquals(BondKind.DOWN, ct.getAtom(1).getBondTo(0).get().getKind());
		assertEquals(BondKind.UP, ct.getAtom(2).getBondTo(3).get().getKind());
		assertEquals(BondKind.DOWN, ct.getAtom(3).getBondTo(2).get().getKind());
	}

	@Test
	public void directionalRingBond() throws Exception{
		ConnectionTable ct = graph("C/1CCCC1");
		assertEquals(BondKind.UP, ct.getAtom(0).getBondTo(4).get().getKind());
		assertEquals(BondKind.DOWN, ct.getAtom(4).getBondTo(0).get().getKind());
	}

	@Test
	public void componentsAreNumberedOneAfterAnother() throws Exception{
		ConnectionTable ct = graph("CC.O");
		assertEquals(3, ct.getAtomCount());
		assertEquals(1, ct.getBondCount());
		assertEquals(0, ct.getAtom(2).getBondCount());
	}

	@Test
	public void handBuiltTree() throws Exception{
		BranchNode c = new BranchNode(AtomKind.aliphatic(Element.C));
		c.addChild(BondKind.DOUBLE, new BranchNode(AtomKind.aliphatic(Element.O)));
		ConnectionTable ct = GraphBuilder.fromTree(c);
		assertEquals(BondKind.DOUBLE, ct.getAtom(1).getBonds().get(0).getKind());
		assertEquals(0, ct.getAtom(1).getBonds().get(0).getTarget());
		assertFalse(ct.getTrace().isPresent());
	}

	@Test(expected = IllegalStateException.class)
	public void openRingBondInTreeIsRejected() throws Exception{
		BranchNode c = new BranchNode(AtomKind.aliphatic(Element.C));
		c.addRingBond(new RingBond(1, 0, BondKind.ELIDED, 1));
		GraphBuilder.fromTree(c);
	}

	@Test
	public void traceIsAttached() throws Exception{
		Trace trace = new Trace();
		Reading r = SmilesParser.parse("CO", trace);
		ConnectionTable ct = GraphBuilder.fromTree(r.getRoots(), trace);
		assertTrue(ct.getTrace().isPresent());
		assertEquals(1, ct.getTrace().get().atom(1).get().getStart());
	}

	@Test(expected = IllegalArgumentException.class)
	public void selfBondIsRejected(){
		ConnectionTable ct = new ConnectionTable();
		ct.addAtom(AtomKind.star());
		ct.addBond(0, BondKind.SINGLE, 0);
	}
}
