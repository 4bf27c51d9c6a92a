package gov.nih.ncats.smiles.feature;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * What an atom is, as written in SMILES. Exactly one of four shapes holds,
 * given by {@link #getType()}:
 * <ul>
 * <li>{@link Type#STAR}: the wildcard {@code *}</li>
 * <li>{@link Type#ALIPHATIC}: an organic subset atom such as {@code C} or {@code Cl}</li>
 * <li>{@link Type#AROMATIC}: an aromatic organic subset atom such as {@code c}</li>
 * <li>{@link Type#BRACKET}: a bracket atom such as {@code [13CH3+:2]}</li>
 * </ul>
 * Only bracket atoms carry isotope, configuration, hydrogen count, charge and map.
 * A bracket atom with no element is a bracketed wildcard, {@code [*]}.
 * <p>
 * Instances are immutable.
 */
public final class AtomKind {

	public enum Type{
		STAR,
		ALIPHATIC,
		AROMATIC,
		BRACKET
	}

	private static final AtomKind STAR = new AtomKind(Type.STAR, null, false, null, null, null, null, null);

	private final Type type;
	private final Element element;
	private final boolean aromatic;
	private final Integer isotope;
	private final Configuration configuration;
	private final Integer hcount;
	private final Integer charge;
	private final Integer map;

	private AtomKind(Type type, Element element, boolean aromatic, Integer isotope,
			Configuration configuration, Integer hcount, Integer charge, Integer map){
		this.type=type;
		this.element=element;
		this.aromatic=aromatic;
		this.isotope=isotope;
		this.configuration=configuration;
		this.hcount=hcount;
		this.charge=charge;
		this.map=map;
	}

	public static AtomKind star(){
		return STAR;
	}

	/**
	 * An unbracketed organic subset atom.
	 * @throws IllegalArgumentException if the element is not in the organic subset.
	 */
	public static AtomKind aliphatic(Element element){
		Objects.requireNonNull(element);
		if(!element.isOrganic()){
			throw new IllegalArgumentException(element + " must be written in brackets");
		}
		return new AtomKind(Type.ALIPHATIC, element, false, null, null, null, null, null);
	}

	/**
	 * An unbracketed aromatic atom.
	 * @throws IllegalArgumentException if the element has no unbracketed aromatic form.
	 */
	public static AtomKind aromatic(Element element){
		Objects.requireNonNull(element);
		if(!element.isAromaticOrganic()){
			throw new IllegalArgumentException(element + " can not be written as an unbracketed aromatic atom");
		}
		return new AtomKind(Type.AROMATIC, element, true, null, null, null, null, null);
	}

	public static BracketBuilder bracket(Element element){
		return new BracketBuilder(Objects.requireNonNull(element));
	}

	/**
	 * Start a bracket atom whose symbol is the wildcard, as in {@code [*]}.
	 */
	public static BracketBuilder bracketStar(){
		return new BracketBuilder(null);
	}

	public Type getType() {
		return type;
	}

	/**
	 * The element, or empty for either form of the wildcard.
	 */
	public Optional<Element> getElement() {
		return Optional.ofNullable(element);
	}

	/**
	 * Whether the atom was written with a lowercase symbol, either
	 * unbracketed or inside brackets.
	 */
	public boolean isAromatic() {
		return aromatic;
	}

	public boolean isBracket(){
		return type==Type.BRACKET;
	}

	public boolean isStar(){
		return element==null;
	}

	public OptionalInt getIsotope() {
		return optional(isotope);
	}

	public Optional<Configuration> getConfiguration() {
		return Optional.ofNullable(configuration);
	}

	/**
	 * This kind with its configuration inverted, or this kind itself if it
	 * has none.
	 * @see Configuration#invert()
	 */
	public AtomKind invertConfiguration(){
		if(configuration==null || configuration.invert()==configuration){
			return this;
		}
		return new AtomKind(type, element, aromatic, isotope, configuration.invert(), hcount, charge, map);
	}

	/**
	 * The explicit hydrogen count of a bracket atom. Empty when the atom is
	 * not a bracket atom or no hydrogen count was written.
	 */
	public OptionalInt getHcount() {
		return optional(hcount);
	}

	public OptionalInt getCharge() {
		return optional(charge);
	}

	public OptionalInt getMap() {
		return optional(map);
	}

	/**
	 * Whether this bracket atom carries anything besides its symbol and
	 * hydrogen count that would be lost without brackets.
	 */
	public boolean hasBracketOnlyFeatures(){
		return isotope!=null || configuration!=null || charge!=null || map!=null;
	}

	private static OptionalInt optional(Integer i){
		return i==null?OptionalInt.empty():OptionalInt.of(i);
	}

	@Override
	public boolean equals(Object o){
		if(this==o){
			return true;
		}
		if(!(o instanceof AtomKind)){
			return false;
		}
		AtomKind other=(AtomKind)o;
		return type==other.type
				&& element==other.element
				&& aromatic==other.aromatic
				&& configuration==other.configuration
				&& Objects.equals(isotope, other.isotope)
				&& Objects.equals(hcount, other.hcount)
				&& Objects.equals(charge, other.charge)
				&& Objects.equals(map, other.map);
	}

	@Override
	public int hashCode(){
		return Objects.hash(type, element, aromatic, isotope, configuration, hcount, charge, map);
	}

	/**
	 * The SMILES text of this atom.
	 */
	@Override
	public String toString(){
		switch(type){
		case STAR:
			return "*";
		case ALIPHATIC:
			return element.getSymbol();
		case AROMATIC:
			return element.getAromaticSymbol();
		default:
			StringBuilder sb = new StringBuilder("[");
			if(isotope!=null){
				sb.append(isotope);
			}
			if(element==null){
				sb.append('*');
			}else{
				sb.append(aromatic?element.getAromaticSymbol():element.getSymbol());
			}
			if(configuration!=null){
				sb.append(configuration.getSymbol());
			}
			if(hcount!=null){
				sb.append('H');
				if(hcount!=1){
					sb.append(hcount);
				}
			}
			if(charge!=null){
				sb.append(charge<0?'-':'+');
				if(Math.abs(charge)!=1){
					sb.append(Math.abs(charge));
				}
			}
			if(map!=null){
				sb.append(':').append(map);
			}
			return sb.append(']').toString();
		}
	}

	/**
	 * Assembles a bracket atom. Fields left unset are absent,
	 * which is distinct from zero.
	 */
	public static final class BracketBuilder{
		private final Element element;
		private boolean aromatic;
		private Integer isotope;
		private Configuration configuration;
		private Integer hcount;
		private Integer charge;
		private Integer map;

		private BracketBuilder(Element element){
			this.element=element;
		}

		/**
		 * Write the symbol in lowercase.
		 * @throws IllegalArgumentException if the element has no aromatic bracket form.
		 */
		public BracketBuilder aromatic(boolean aromatic){
			if(aromatic && (element==null || !element.isBracketAromatic())){
				throw new IllegalArgumentException((element==null?"*":element.getSymbol()) + " has no aromatic form");
			}
			this.aromatic=aromatic;
			return this;
		}

		public BracketBuilder isotope(int isotope){
			if(isotope<0 || isotope>999){
				throw new IllegalArgumentException("isotope must be between 0 and 999: " + isotope);
			}
			this.isotope=isotope;
			return this;
		}

		public BracketBuilder configuration(Configuration configuration){
			this.configuration=configuration;
			return this;
		}

		public BracketBuilder hcount(int hcount){
			if(hcount<0 || hcount>9){
				throw new IllegalArgumentException("hydrogen count must be between 0 and 9: " + hcount);
			}
			this.hcount=hcount;
			return this;
		}

		public BracketBuilder charge(int charge){
			if(charge<-15 || charge>15){
				throw new IllegalArgumentException("charge must be between -15 and 15: " + charge);
			}
			this.charge=charge;
			return this;
		}

		public BracketBuilder map(int map){
			if(map<0 || map>999){
				throw new IllegalArgumentException("map must be between 0 and 999: " + map);
			}
			this.map=map;
			return this;
		}

		public AtomKind build(){
			return new AtomKind(Type.BRACKET, element, aromatic, isotope, configuration, hcount, charge, map);
		}
	}
}
