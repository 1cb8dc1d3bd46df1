package gov.nih.ncats.molrender.internal.util;

import java.util.function.Supplier;

/**
 * Memoized supplier. Computes the value on the first {@link #get()}
 * and hands out the same value until {@link #resetCache()} is called.
 *
 * @param <T>
 */
public class CachedSupplier<T> implements Supplier<T>{

	private final Supplier<T> c;
	private T cache;
	private boolean run=false;

	public CachedSupplier(final Supplier<T> c){
		this.c=c;
	}

	@Override
	public synchronized T get() {
		if(!run){
			this.cache=c.get();
			this.run=true;
		}
		return this.cache;
	}

	/**
	 * Recalculate from the wrapped supplier on next call.
	 */
	public synchronized void resetCache(){
		this.run=false;
		this.cache=null;
	}

	public static <T> CachedSupplier<T> of(final Supplier<T> supplier){
		return new CachedSupplier<T>(supplier);
	}
}
