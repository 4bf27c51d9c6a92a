package gov.nih.ncats.smiles.tree;

import java.util.Objects;

import gov.nih.ncats.smiles.feature.BondKind;

/**
 * An outgoing connection of a {@link BranchNode}: either a bond to a child
 * subtree, owned by this link, or one end of a resolved ring closure.
 */
public final class Link {

	private final BondKind kind;
	private final BranchNode target;
	private final RingBond ringBond;

	private Link(BondKind kind, BranchNode target, RingBond ringBond){
		this.kind=kind;
		this.target=target;
		this.ringBond=ringBond;
	}

	public static Link bond(BondKind kind, BranchNode target){
		return new Link(Objects.requireNonNull(kind), Objects.requireNonNull(target), null);
	}

	public static Link ringClosure(RingBond ringBond){
		return new Link(null, null, Objects.requireNonNull(ringBond));
	}

	public boolean isBond(){
		return target!=null;
	}

	public boolean isRingClosure(){
		return ringBond!=null;
	}

	/**
	 * The kind of a bond link, as seen from its parent.
	 * @throws IllegalStateException for a ring closure; ask the {@link RingBond} instead.
	 */
	public BondKind getKind(){
		if(!isBond()){
			throw new IllegalStateException("ring closure kinds depend on the end; use getRingBond()");
		}
		return kind;
	}

	/**
	 * @throws IllegalStateException if this is a ring closure.
	 */
	public BranchNode getTarget(){
		if(!isBond()){
			throw new IllegalStateException("ring closure has no target node");
		}
		return target;
	}

	/**
	 * @throws IllegalStateException if this is a bond link.
	 */
	public RingBond getRingBond(){
		if(!isRingClosure()){
			throw new IllegalStateException("not a ring closure");
		}
		return ringBond;
	}

	@Override
	public String toString(){
		if(isBond()){
			return "Link{" + kind + " -> " + target.getKind() + "}";
		}
		return "Link{" + ringBond + "}";
	}
}
