package gov.nih.ncats.smiles.valence;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import gov.nih.ncats.smiles.HypervalentAtomException;
import gov.nih.ncats.smiles.feature.AtomKind;
import gov.nih.ncats.smiles.feature.BondKind;
import gov.nih.ncats.smiles.feature.Element;
import gov.nih.ncats.smiles.graph.Atom;
import gov.nih.ncats.smiles.graph.Bond;
import gov.nih.ncats.smiles.graph.ConnectionTable;

/**
 * Infers how many hydrogens an atom carries without writing them.
 * <p>
 * The sum of the atom's bond orders is matched against the smallest
 * permitted valence that can hold it. A lowercase aromatic atom that still
 * has room after that gives one unit to the delocalized system, so the
 * oxygen of {@code c1ccoc1} infers none and the carbons of benzene one.
 * The result is
 * empty, meaning not applicable, for bracket atoms that state their own
 * hydrogen count, for wildcards, and for elements or charges the
 * {@link ValenceTable} does not list.
 */
public final class ImplicitHydrogens {

	private static final Logger logger = Logger.getLogger(ImplicitHydrogens.class.getName());

	private ImplicitHydrogens(){
		//can not instantiate
	}

	public static OptionalInt of(ConnectionTable ct, int atomId) throws HypervalentAtomException{
		return of(ct.getAtom(atomId));
	}

	public static OptionalInt of(Atom atom) throws HypervalentAtomException{
		List<BondKind> kinds = atom.getBonds().stream()
				.map(Bond::getKind)
				.collect(Collectors.toList());
		return compute(atom.getKind(), kinds, atom.getId(), ValenceTable.getDefault());
	}

	/**
	 * @param kind the atom.
	 * @param bonds the kinds of every bond at that atom, in any order.
	 * @throws HypervalentAtomException with atom id -1 if no permitted
	 * valence is large enough.
	 */
	public static OptionalInt of(AtomKind kind, List<BondKind> bonds) throws HypervalentAtomException{
		return compute(kind, bonds, -1, ValenceTable.getDefault());
	}

	public static OptionalInt of(AtomKind kind, List<BondKind> bonds, ValenceTable table) throws HypervalentAtomException{
		return compute(kind, bonds, -1, table);
	}

	private static OptionalInt compute(AtomKind kind, List<BondKind> bonds, int atomId, ValenceTable table) throws HypervalentAtomException{
		Objects.requireNonNull(kind);
		Objects.requireNonNull(bonds);
		if(kind.isStar() || kind.getHcount().isPresent()){
			return OptionalInt.empty();
		}
		Element element = kind.getElement().get();
		int charge = kind.getCharge().orElse(0);
		Optional<int[]> valences = table.getValences(element, charge);
		if(!valences.isPresent()){
			return OptionalInt.empty();
		}

		int sum = 0;
		for(BondKind b : bonds){
			sum+=b.getOrder();
		}
		for(int v : valences.get()){
			if(v>=sum){
				int gap = v-sum;
				//an aromatic atom with room left gives one unit to the ring
				if(gap>0 && kind.isAromatic()){
					gap--;
				}
				return OptionalInt.of(gap);
			}
		}
		logger.fine("hypervalent " + kind + " with bond order sum " + sum + (atomId<0?"":" at atom " + atomId));
		throw new HypervalentAtomException(atomId, sum);
	}
}
