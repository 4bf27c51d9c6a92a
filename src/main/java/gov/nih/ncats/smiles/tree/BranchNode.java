package gov.nih.ncats.smiles.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

import gov.nih.ncats.smiles.feature.AtomKind;
import gov.nih.ncats.smiles.feature.BondKind;

/**
 * An atom of the parse tree. Each node owns the subtrees reached through
 * its {@link Link#isBond() bond} links. Ring closures are links that
 * refer to a shared {@link RingBond} rather than to another node, so the
 * tree stays acyclic even when the molecule is not.
 * <p>
 * Links are kept in the order they appear in the text.
 */
public class BranchNode{

	private final AtomKind kind;
	private final List<Link> links = new ArrayList<>();

	public BranchNode(AtomKind kind){
		this.kind=Objects.requireNonNull(kind);
	}

	public AtomKind getKind(){
		return this.kind;
	}

	public List<Link> getLinks(){
		return Collections.unmodifiableList(links);
	}

	public BranchNode addLink(Link link){
		this.links.add(Objects.requireNonNull(link));
		return this;
	}

	/**
	 * Add a bond to a child subtree.
	 * @return the child, so chains can be extended.
	 */
	public BranchNode addChild(BondKind kind, BranchNode child){
		addLink(Link.bond(kind, child));
		return child;
	}

	public BranchNode addRingBond(RingBond ringBond){
		return addLink(Link.ringClosure(ringBond));
	}

	public boolean hasChildren(){
		return links.stream().anyMatch(Link::isBond);
	}

	/**
	 * Visit every node of this subtree in pre-order, which is the order
	 * in which their atoms appear in the text. The consumer gets the parent
	 * (null for this node) and the node.
	 */
	public void forEachBranchNode(BiConsumer<BranchNode,BranchNode> consumer){
		List<BranchNode[]> stack = new ArrayList<>();
		stack.add(new BranchNode[]{null,this});
		while(!stack.isEmpty()){
			BranchNode[] top = stack.remove(stack.size()-1);
			consumer.accept(top[0], top[1]);
			List<Link> l = top[1].links;
			for(int i=l.size()-1;i>=0;i--){
				if(l.get(i).isBond()){
					stack.add(new BranchNode[]{top[1],l.get(i).getTarget()});
				}
			}
		}
	}

	/**
	 * Number of atoms in this subtree.
	 */
	public int size(){
		int[] count = new int[]{0};
		forEachBranchNode((p,c)->count[0]++);
		return count[0];
	}

	@Override
	public String toString(){
		return "BranchNode{" + kind + ", links=" + links.size() + "}";
	}
}
