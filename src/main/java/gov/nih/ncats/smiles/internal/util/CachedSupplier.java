package gov.nih.ncats.smiles.internal.util;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Memoized supplier. Calls the delegate at most once, on first use,
 * and hands back the same value after that. Safe to share between threads.
 *
 * @param <T>
 */
public class CachedSupplier<T> implements Supplier<T>{

	private final Supplier<T> c;
	private volatile T cache;
	private volatile boolean run=false;

	public CachedSupplier(final Supplier<T> c){
		this.c=Objects.requireNonNull(c);
	}

	@Override
	public T get() {
		if(run) {
			return this.cache;
		}
		synchronized(this){
			if(run){
				return this.cache;
			}
			this.cache=c.get();
			this.run=true;
			return this.cache;
		}
	}

	public boolean hasRun(){
		return this.run;
	}

	public static <T> CachedSupplier<T> of(final Supplier<T> supplier){
		return new CachedSupplier<T>(supplier);
	}
}
