package org.springaicommunity.gitea.reconciler;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Lazily populated, invalidatable list of remote objects scoped to one
 * {@link RepositorySession}.
 *
 * <p>
 * The first {@link #get()} on an unpopulated cache fetches the whole collection. Callers
 * arriving while that fetch is in flight wait on the same {@link CompletableFuture}
 * instead of issuing their own request. A failed fetch leaves the cache unpopulated and
 * the error is rethrown to every waiter.
 *
 * <p>
 * The loader runs outside the internal lock; only state transitions are synchronized.
 *
 * @param <T> the cached element type
 */
public class ListCache<T> {

	private static final Logger logger = LoggerFactory.getLogger(ListCache.class);

	private final String name;

	private final Supplier<List<T>> loader;

	private final Object lock = new Object();

	private CacheState state = CacheState.UNPOPULATED;

	@Nullable
	private CompletableFuture<List<T>> inFlight;

	private List<T> items = new ArrayList<>();

	public ListCache(String name, Supplier<List<T>> loader) {
		this.name = name;
		this.loader = loader;
	}

	/**
	 * Return the cached collection, populating it first if needed.
	 * @return an immutable snapshot of the collection
	 */
	public List<T> get() {
		CompletableFuture<List<T>> future;
		boolean owner = false;
		synchronized (lock) {
			if (state == CacheState.POPULATED) {
				return List.copyOf(items);
			}
			if (state == CacheState.POPULATING && inFlight != null) {
				future = inFlight;
			}
			else {
				future = new CompletableFuture<>();
				inFlight = future;
				state = CacheState.POPULATING;
				owner = true;
			}
		}
		if (owner) {
			return populate(future);
		}
		logger.debug("Waiting for in-flight {} fetch", name);
		try {
			return future.join();
		}
		catch (CompletionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			throw e;
		}
	}

	private List<T> populate(CompletableFuture<List<T>> future) {
		List<T> fetched;
		try {
			fetched = List.copyOf(loader.get());
		}
		catch (RuntimeException e) {
			synchronized (lock) {
				if (inFlight == future) {
					inFlight = null;
					state = CacheState.UNPOPULATED;
				}
			}
			future.completeExceptionally(e);
			throw e;
		}
		synchronized (lock) {
			// An invalidation during the fetch wins; the result is handed out but not kept
			if (inFlight == future) {
				items = new ArrayList<>(fetched);
				state = CacheState.POPULATED;
				inFlight = null;
			}
		}
		logger.debug("Populated {} cache with {} entries", name, fetched.size());
		future.complete(fetched);
		return fetched;
	}

	public CacheState state() {
		synchronized (lock) {
			return state;
		}
	}

	/**
	 * Return the collection only if it is already populated, without fetching.
	 */
	public Optional<List<T>> peek() {
		synchronized (lock) {
			return state == CacheState.POPULATED ? Optional.of(List.copyOf(items)) : Optional.empty();
		}
	}

	/**
	 * Reset to unpopulated so the next access refetches. An in-flight fetch is detached.
	 */
	public void invalidate() {
		synchronized (lock) {
			if (state != CacheState.UNPOPULATED) {
				logger.debug("Invalidating {} cache", name);
			}
			state = CacheState.UNPOPULATED;
			inFlight = null;
			items = new ArrayList<>();
		}
	}

	/**
	 * Append an element created by this process. While a fetch is in flight the cache is
	 * invalidated instead, since that fetch may or may not include the element.
	 * @param item the new element
	 * @return true if the element was appended
	 */
	public boolean appendIfPopulated(T item) {
		synchronized (lock) {
			if (state == CacheState.POPULATED) {
				items.add(item);
				return true;
			}
			if (state == CacheState.POPULATING) {
				invalidate();
			}
			return false;
		}
	}

	/**
	 * Replace every cached element matching {@code match} with {@code replacement}.
	 * Appends the replacement when the cache is populated but holds no match.
	 * @param match identifies the stale element
	 * @param replacement the fresh element
	 * @return true if the cache was changed
	 */
	public boolean replaceIfPopulated(Predicate<T> match, T replacement) {
		synchronized (lock) {
			if (state == CacheState.POPULATING) {
				invalidate();
				return false;
			}
			if (state != CacheState.POPULATED) {
				return false;
			}
			boolean replaced = false;
			for (int i = 0; i < items.size(); i++) {
				if (match.test(items.get(i))) {
					items.set(i, replacement);
					replaced = true;
				}
			}
			if (!replaced) {
				items.add(replacement);
			}
			return true;
		}
	}

	@Override
	public String toString() {
		return "ListCache[" + name + ", " + state() + "]";
	}

}
