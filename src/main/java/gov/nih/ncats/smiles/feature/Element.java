package gov.nih.ncats.smiles.feature;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Chemical elements, in atomic number order. The enum constant name is
 * the element symbol as it appears inside a bracket atom.
 */
public enum Element {
	H, He, Li, Be, B, C,
	N, O, F, Ne, Na, Mg,
	Al, Si, P, S, Cl, Ar,
	K, Ca, Sc, Ti, V, Cr,
	Mn, Fe, Co, Ni, Cu, Zn,
	Ga, Ge, As, Se, Br, Kr,
	Rb, Sr, Y, Zr, Nb, Mo,
	Tc, Ru, Rh, Pd, Ag, Cd,
	In, Sn, Sb, Te, I, Xe,
	Cs, Ba, La, Ce, Pr, Nd,
	Pm, Sm, Eu, Gd, Tb, Dy,
	Ho, Er, Tm, Yb, Lu, Hf,
	Ta, W, Re, Os, Ir, Pt,
	Au, Hg, Tl, Pb, Bi, Po,
	At, Rn, Fr, Ra, Ac, Th,
	Pa, U, Np, Pu, Am, Cm,
	Bk, Cf, Es, Fm, Md, No,
	Lr, Rf, Db, Sg, Bh, Hs,
	Mt, Ds, Rg, Cn, Nh, Fl,
	Mc, Lv, Ts, Og;

	private static final Map<String,Element> BY_SYMBOL;
	
	private static final Set<Element> ORGANIC = Collections.unmodifiableSet(
			EnumSet.of(B, C, N, O, P, S, F, Cl, Br, I, At, Ts));
	
	private static final Set<Element> AROMATIC = Collections.unmodifiableSet(
			EnumSet.of(B, C, N, O, P, S));
	
	private static final Set<Element> BRACKET_AROMATIC = Collections.unmodifiableSet(
			EnumSet.of(B, C, N, O, P, S, Se, As));
	
	static{
		Map<String,Element> map = new HashMap<>();
		for(Element e : values()){
			map.put(e.name(), e);
		}
		BY_SYMBOL=Collections.unmodifiableMap(map);
	}
	
	public String getSymbol(){
		return name();
	}
	
	/**
	 * The lowercase form used for aromatic atoms, e.g. "c" or "se".
	 */
	public String getAromaticSymbol(){
		return name().toLowerCase();
	}
	
	/**
	 * Whether the element may be written without brackets.
	 */
	public boolean isOrganic(){
		return ORGANIC.contains(this);
	}
	
	/**
	 * Whether the element may be written as a lowercase aromatic atom
	 * without brackets.
	 */
	public boolean isAromaticOrganic(){
		return AROMATIC.contains(this);
	}
	
	/**
	 * Whether the element may be written as a lowercase aromatic symbol
	 * inside brackets.
	 */
	public boolean isBracketAromatic(){
		return BRACKET_AROMATIC.contains(this);
	}
	
	/**
	 * Look up an element by its case-sensitive symbol.
	 * @param symbol the symbol, for example "Cl".
	 * @return the element, or empty if there is no element with that symbol.
	 */
	public static Optional<Element> fromSymbol(String symbol){
		return Optional.ofNullable(BY_SYMBOL.get(symbol));
	}
}
