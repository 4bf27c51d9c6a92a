package gov.nih.ncats.smiles.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import gov.nih.ncats.smiles.IncompatibleBondException;
import gov.nih.ncats.smiles.feature.BondKind;
import gov.nih.ncats.smiles.internal.util.Tuple;
import gov.nih.ncats.smiles.read.Trace;
import gov.nih.ncats.smiles.tree.BranchNode;
import gov.nih.ncats.smiles.tree.Link;
import gov.nih.ncats.smiles.tree.RingBond;

/**
 * Flattens parse trees into a {@link ConnectionTable}.
 * <p>
 * Atoms get ids in pre-order, root by root, which is the order they were
 * read. Each atom's bonds are listed as the text shows them: the bond to
 * its parent first, then its links in order.
 */
public final class GraphBuilder {

	private GraphBuilder(){
		//can not instantiate
	}

	public static ConnectionTable fromTree(BranchNode root) throws IncompatibleBondException{
		return fromTree(Collections.singletonList(root), null);
	}

	/**
	 * @param roots one tree per disconnected component, in text order.
	 * @param trace the trace kept while reading these trees, or null.
	 * It is attached to the table as is; its atom ids are the table's ids.
	 * @throws IncompatibleBondException if the two ends of a ring bond do not agree.
	 * @throws IllegalStateException if a ring bond is still open or is held
	 * by an atom that is not one of its ends.
	 */
	public static ConnectionTable fromTree(List<BranchNode> roots, Trace trace) throws IncompatibleBondException{
		Objects.requireNonNull(roots);
		ConnectionTable ct = new ConnectionTable();

		//(parent, node) in pre-order
		List<Tuple<BranchNode,BranchNode>> preorder = new ArrayList<>();
		for(BranchNode root: roots){
			root.forEachBranchNode((p,n)->preorder.add(Tuple.of(p, n)));
		}
		Map<BranchNode,Integer> ids = new IdentityHashMap<>();
		for(Tuple<BranchNode,BranchNode> t : preorder){
			if(ids.put(t.v(), ct.addAtom(t.v().getKind()).getId())!=null){
				throw new IllegalStateException("atom reachable twice in tree: " + t.v());
			}
		}

		for(Tuple<BranchNode,BranchNode> t : preorder){
			BranchNode parent = t.k();
			BranchNode node = t.v();
			int id = ids.get(node);
			Atom atom = ct.getAtom(id);
			if(parent!=null){
				atom.addBond(kindTo(parent, node).reverse(), ids.get(parent));
			}
			for(Link l : node.getLinks()){
				if(l.isBond()){
					atom.addBond(l.getKind(), ids.get(l.getTarget()));
					continue;
				}
				RingBond rb = l.getRingBond();
				if(!rb.isClosed()){
					throw new IllegalStateException("ring bond " + rb.getNumber() + " was never closed");
				}
				if(rb.getOpenKind().reverse()!=rb.getCloseKind()){
					throw new IncompatibleBondException(-1, rb.getOpenId(), rb.getCloseId());
				}
				if(id!=rb.getOpenId() && id!=rb.getCloseId()){
					throw new IllegalStateException("atom " + id + " holds " + rb + " but is not one of its ends");
				}
				atom.addBond(rb.getKindAt(id), rb.getPartner(id));
			}
		}
		if(trace!=null){
			ct.setTrace(trace);
		}
		return ct;
	}

	private static BondKind kindTo(BranchNode parent, BranchNode child){
		for(Link l : parent.getLinks()){
			if(l.isBond() && l.getTarget()==child){
				return l.getKind();
			}
		}
		throw new IllegalStateException("child not linked from its parent");
	}
}
