package gov.nih.ncats.smiles.read;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import gov.nih.ncats.smiles.internal.util.Tuple;

/**
 * Where each parsed entity came from in the SMILES text. Pass a fresh
 * instance to {@link SmilesParser#parse(String, Trace)} to have it
 * filled in; it is read only once parsing completes, and can not be reused.
 * <ul>
 * <li>atoms: the range of the token that made each atom, by atom id.</li>
 * <li>bonds: one cursor per bond id, ids given in the order bonds were
 * read. A chain bond points at its symbol, or at the atom after it if it
 * has none. Each end of a ring closure has its own id, pointing at its
 * bond symbol or else its ring bond number.</li>
 * <li>rnums: the range of every ring bond number token, in text order.</li>
 * </ul>
 */
public final class Trace {

	private final List<CursorRange> atoms = new ArrayList<>();
	private final List<Integer> bonds = new ArrayList<>();
	private final List<CursorRange> rnums = new ArrayList<>();
	private final Map<Tuple<Integer,Integer>,Integer> bondIds = new HashMap<>();

	private boolean started;
	private boolean complete;

	public Optional<CursorRange> atom(int id){
		return id<0 || id>=atoms.size()?Optional.empty():Optional.of(atoms.get(id));
	}

	/**
	 * The bond id read between two atoms, seen from a. Chain bonds have
	 * the same id both ways; a ring closure answers with the id of the
	 * ring bond number written at a. If two atoms are bonded more than
	 * once, the first bond read wins.
	 */
	public OptionalInt bondId(int a, int b){
		Integer id = bondIds.get(Tuple.of(a, b));
		return id==null?OptionalInt.empty():OptionalInt.of(id);
	}

	/**
	 * The cursor of a bond id.
	 */
	public OptionalInt bond(int bondId){
		return bondId<0 || bondId>=bonds.size()?OptionalInt.empty():OptionalInt.of(bonds.get(bondId));
	}

	public Optional<CursorRange> rnum(int i){
		return i<0 || i>=rnums.size()?Optional.empty():Optional.of(rnums.get(i));
	}

	public int getAtomCount(){
		return atoms.size();
	}

	public int getBondCount(){
		return bonds.size();
	}

	public int getRnumCount(){
		return rnums.size();
	}

	public boolean isComplete(){
		return complete;
	}

	void start(){
		if(started){
			throw new IllegalStateException("trace already used by another parse");
		}
		started=true;
	}

	void complete(){
		complete=true;
	}

	private void checkWritable(){
		if(complete){
			throw new IllegalStateException("trace is complete");
		}
	}

	void addAtom(CursorRange range){
		checkWritable();
		atoms.add(range);
	}

	int addBond(int cursor){
		checkWritable();
		bonds.add(cursor);
		return bonds.size()-1;
	}

	void mapBond(int a, int b, int bondId){
		checkWritable();
		bondIds.putIfAbsent(Tuple.of(a, b), bondId);
	}

	void addRnum(CursorRange range){
		checkWritable();
		rnums.add(range);
	}
}
