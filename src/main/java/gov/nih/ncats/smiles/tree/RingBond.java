package gov.nih.ncats.smiles.tree;

import java.util.Objects;

import gov.nih.ncats.smiles.feature.BondKind;

/**
 * A bond written as a pair of ring bond numbers. Created when the number
 * is first seen and closed when it is seen again; both ends of the tree
 * hold a {@link Link} to the same instance.
 * <p>
 * Atom ids are the parse order ids, the same ids the graph uses.
 */
public final class RingBond {

	private final int number;
	private final int openId;
	private final int openCursor;
	private BondKind openKind;
	private int closeId=-1;
	private int closeCursor=-1;
	private BondKind closeKind;

	/**
	 * @param number the ring bond number, 0 to 99.
	 * @param openId the atom id where the number was first written.
	 * @param openKind the bond kind written before the opening number.
	 * @param openCursor offset of the opening number.
	 */
	public RingBond(int number, int openId, BondKind openKind, int openCursor){
		this.number=number;
		this.openId=openId;
		this.openKind=Objects.requireNonNull(openKind);
		this.openCursor=openCursor;
	}

	/**
	 * Close this ring bond at the given atom, reconciling the bond kinds
	 * written at each end.
	 * @return false if the kinds conflict, in which case this ring bond is unchanged.
	 * @throws IllegalStateException if already closed.
	 */
	public boolean close(int closeId, BondKind kind, int closeCursor){
		if(isClosed()){
			throw new IllegalStateException("ring bond " + number + " already closed");
		}
		return BondKind.reconcile(openKind, kind)
			.map(pair->{
				this.openKind=pair[0];
				this.closeKind=pair[1];
				this.closeId=closeId;
				this.closeCursor=closeCursor;
				return true;
			})
			.orElse(false);
	}

	public boolean isClosed(){
		return closeId>=0;
	}

	public int getNumber() {
		return number;
	}

	public int getOpenId() {
		return openId;
	}

	public int getOpenCursor() {
		return openCursor;
	}

	/**
	 * The kind as seen from the opening atom; resolved once closed.
	 */
	public BondKind getOpenKind() {
		return openKind;
	}

	/**
	 * @return the closing atom id, or -1 while open.
	 */
	public int getCloseId() {
		return closeId;
	}

	public int getCloseCursor() {
		return closeCursor;
	}

	/**
	 * The kind as seen from the closing atom, or null while open.
	 */
	public BondKind getCloseKind() {
		return closeKind;
	}

	/**
	 * The other end of this ring bond.
	 * @throws IllegalArgumentException if id is not an end of this bond.
	 */
	public int getPartner(int id){
		if(id==openId){
			return closeId;
		}
		if(id==closeId){
			return openId;
		}
		throw new IllegalArgumentException("atom " + id + " is not an end of ring bond " + number);
	}

	/**
	 * The resolved kind as seen from the given end.
	 * @throws IllegalArgumentException if id is not an end of this bond.
	 */
	public BondKind getKindAt(int id){
		if(id==openId){
			return openKind;
		}
		if(id==closeId){
			return closeKind;
		}
		throw new IllegalArgumentException("atom " + id + " is not an end of ring bond " + number);
	}

	@Override
	public String toString(){
		return "RingBond{" + number + ": " + openId + openKind.getSymbol() + " " + closeId
				+ (closeKind==null?"":closeKind.getSymbol()) + "}";
	}
}
