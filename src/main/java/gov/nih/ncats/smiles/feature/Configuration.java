package gov.nih.ncats.smiles.feature;

import java.util.Optional;

/**
 * Chirality markers allowed inside a bracket atom. The tetrahedral
 * classes are written in their short forms, {@code @} and {@code @@}.
 */
public enum Configuration {
	TH1("@"), TH2("@@"), AL1("@AL1"), AL2("@AL2"), SP1("@SP1"),
	SP2("@SP2"), SP3("@SP3"), TB1("@TB1"), TB2("@TB2"), TB3("@TB3"),
	TB4("@TB4"), TB5("@TB5"), TB6("@TB6"), TB7("@TB7"), TB8("@TB8"),
	TB9("@TB9"), TB10("@TB10"), TB11("@TB11"), TB12("@TB12"), TB13("@TB13"),
	TB14("@TB14"), TB15("@TB15"), TB16("@TB16"), TB17("@TB17"), TB18("@TB18"),
	TB19("@TB19"), TB20("@TB20"), OH1("@OH1"), OH2("@OH2"), OH3("@OH3"),
	OH4("@OH4"), OH5("@OH5"), OH6("@OH6"), OH7("@OH7"), OH8("@OH8"),
	OH9("@OH9"), OH10("@OH10"), OH11("@OH11"), OH12("@OH12"), OH13("@OH13"),
	OH14("@OH14"), OH15("@OH15"), OH16("@OH16"), OH17("@OH17"), OH18("@OH18"),
	OH19("@OH19"), OH20("@OH20"), OH21("@OH21"), OH22("@OH22"), OH23("@OH23"),
	OH24("@OH24"), OH25("@OH25"), OH26("@OH26"), OH27("@OH27"), OH28("@OH28"),
	OH29("@OH29"), OH30("@OH30");
	
	private final String symbol;
	
	Configuration(String symbol){
		this.symbol=symbol;
	}
	
	public String getSymbol(){
		return this.symbol;
	}

	/**
	 * The marker for the same center when its neighbors are listed in an
	 * order that is an odd permutation of the original one.
	 * Only {@link #TH1} and {@link #TH2} swap; other classes are returned as is.
	 */
	public Configuration invert(){
		switch(this){
			case TH1: return TH2;
			case TH2: return TH1;
			default: return this;
		}
	}
	
	/**
	 * Look up an explicit class and number, as in {@code @TB12}.
	 * @param chiralClass one of "TH", "AL", "SP", "TB", "OH".
	 * @param number the permutation number.
	 * @return the configuration or empty if the number is out of range for the class.
	 */
	public static Optional<Configuration> of(String chiralClass, int number){
		try{
			return Optional.of(valueOf(chiralClass + number));
		}catch(IllegalArgumentException e){
			return Optional.empty();
		}
	}
}
