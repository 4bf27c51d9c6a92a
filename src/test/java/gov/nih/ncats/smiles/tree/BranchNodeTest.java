package gov.nih.ncats.smiles.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import gov.nih.ncats.smiles.feature.AtomKind;
import gov.nih.ncats.smiles.feature.BondKind;
import gov.nih.ncats.smiles.feature.Element;

public class BranchNodeTest {

	private static BranchNode node(Element e){
		return new BranchNode(AtomKind.aliphatic(e));
	}

	@Test
	public void preOrderVisitsBranchesBeforeTheChainContinues(){
		BranchNode c = node(Element.C);
		BranchNode n = c.addChild(BondKind.ELIDED, node(Element.N));
		n.addChild(BondKind.ELIDED, node(Element.O));
		c.addChild(BondKind.DOUBLE, node(Element.S));

		List<String> seen = new ArrayList<>();
		c.forEachBranchNode((p,b)->seen.add((p==null?"-":p.getKind().toString()) + ">" + b.getKind()));
		assertEquals("[->C, C>N, N>O, C>S]", seen.toString());
		assertEquals(4, c.size());
	}

	@Test
	public void ringClosuresAreNotChildren(){
		BranchNode c = node(Element.C);
		c.addRingBond(new RingBond(1, 0, BondKind.ELIDED, 1));
		assertFalse(c.hasChildren());
		assertEquals(1, c.getLinks().size());
		assertTrue(c.getLinks().get(0).isRingClosure());
		assertEquals(1, c.size());
	}

	@Test(expected = UnsupportedOperationException.class)
	public void linksCanNotBeChangedFromOutside(){
		node(Element.C).getLinks().add(Link.bond(BondKind.SINGLE, node(Element.C)));
	}

	@Test
	public void ringBondClosesWithReconciledKinds(){
		RingBond rb = new RingBond(3, 0, BondKind.ELIDED, 1);
		assertFalse(rb.isClosed());
		assertNull(rb.getCloseKind());
		assertTrue(rb.close(4, BondKind.UP, 9));
		assertTrue(rb.isClosed());
		assertEquals(BondKind.DOWN, rb.getKindAt(0));
		assertEquals(BondKind.UP, rb.getKindAt(4));
		assertEquals(4, rb.getPartner(0));
		assertEquals(0, rb.getPartner(4));
	}

	@Test
	public void conflictingCloseLeavesRingBondOpen(){
		RingBond rb = new RingBond(3, 0, BondKind.DOUBLE, 1);
		assertFalse(rb.close(4, BondKind.TRIPLE, 9));
		assertFalse(rb.isClosed());
		assertEquals(BondKind.DOUBLE, rb.getOpenKind());
	}

	@Test(expected = IllegalArgumentException.class)
	public void partnerOfAStrangerIsAnError(){
		RingBond rb = new RingBond(3, 0, BondKind.ELIDED, 1);
		rb.close(4, BondKind.ELIDED, 9);
		rb.getPartner(2);
	}

	@Test(expected = IllegalStateException.class)
	public void ringClosureLinkHasNoTarget(){
		Link.ringClosure(new RingBond(1, 0, BondKind.ELIDED, 1)).getTarget();
	}
}
