package lrgen.util;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * A simple lru cache implementation, keys are compared by identity.
 */
public class Cache<K, V> {

	private int clock = 0;
	private final Map<K, V> map = new IdentityHashMap<>();
	private final Map<K, Integer> accessTimes = new IdentityHashMap<>();

	private final int maximumSize;

	public Cache(int maximumSize) {
		if (maximumSize < 0){
			throw new IllegalArgumentException("Negative cache size " + maximumSize);
		}
		this.maximumSize = maximumSize;
	}

	private void access(K key){
		accessTimes.put(key, clock++);
	}

	private void ensureSize(){
		while (map.size() > maximumSize){
			K minKey = null;
			int minTime = Integer.MAX_VALUE;
			for (Map.Entry<K, Integer> entry : accessTimes.entrySet()) {
				if (entry.getValue() < minTime){
					minKey = entry.getKey();
					minTime = entry.getValue();
				}
			}
			accessTimes.remove(minKey);
			map.remove(minKey);
		}
	}

	public int size(){
		return map.size();
	}

	public V getIfPresent(K key){
		if (map.containsKey(key)){
			access(key);
			return map.get(key);
		}
		return null;
	}

	public void put(K key, V value){
		access(key);
		map.put(key, value);
		ensureSize();
	}
}
