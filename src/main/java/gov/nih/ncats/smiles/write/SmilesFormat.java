package gov.nih.ncats.smiles.write;

import java.util.List;
import java.util.OptionalInt;
import java.util.logging.Logger;

import gov.nih.ncats.smiles.HypervalentAtomException;
import gov.nih.ncats.smiles.feature.AtomKind;
import gov.nih.ncats.smiles.feature.BondKind;
import gov.nih.ncats.smiles.feature.Element;
import gov.nih.ncats.smiles.valence.ImplicitHydrogens;

/**
 * Text of single atoms, bonds and ring bond numbers.
 */
public final class SmilesFormat {

	private static final Logger logger = Logger.getLogger(SmilesFormat.class.getName());

	private SmilesFormat(){
		//can not instantiate
	}

	public static String ringNumber(int n){
		if(n<0 || n>99){
			throw new IllegalArgumentException("ring bond number out of range: " + n);
		}
		return n<10?Integer.toString(n):"%" + n;
	}

	/**
	 * The symbol to write for a bond between two atoms, seen from {@code from}.
	 * Nothing is written for an elided bond or an aromatic bond between two
	 * aromatic atoms.
	 */
	public static String bond(BondKind kind, AtomKind from, AtomKind to){
		if(kind==BondKind.AROMATIC && from.isAromatic() && to.isAromatic()){
			return "";
		}
		return kind.getSymbol();
	}

	public static String atom(AtomKind kind){
		return kind.toString();
	}

	/**
	 * Atom text, dropping the brackets when the short form reads back
	 * with the same element, aromaticity and hydrogen count. Radicals such
	 * as {@code [C]} or {@code C[O]} keep their brackets.
	 * @param bonds the kinds of every bond at the atom.
	 */
	public static String atom(AtomKind kind, List<BondKind> bonds, boolean debracket){
		if(!debracket || !kind.isBracket() || kind.hasBracketOnlyFeatures()){
			return kind.toString();
		}
		if(kind.isStar()){
			return kind.getHcount().isPresent()?kind.toString():AtomKind.star().toString();
		}
		Element e = kind.getElement().get();
		AtomKind shorthand;
		if(kind.isAromatic()){
			if(!e.isAromaticOrganic()){
				return kind.toString();
			}
			shorthand = AtomKind.aromatic(e);
		}else{
			if(!e.isOrganic()){
				return kind.toString();
			}
			shorthand = AtomKind.aliphatic(e);
		}
		try{
			OptionalInt implicit = ImplicitHydrogens.of(shorthand, bonds);
			//a bracket atom without a count has no hydrogens
			if(implicit.isPresent() && implicit.getAsInt()==kind.getHcount().orElse(0)){
				return shorthand.toString();
			}
		}catch(HypervalentAtomException e1){
			logger.finer("keeping brackets on hypervalent " + kind);
		}
		return kind.toString();
	}
}
