package lrgen.lr;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

/**
 * Immutable, sorted and deduplicated set of items.
 *
 * Item sets with the same items are equal and have the same string representation, regardless of the order
 * in which the items were added, which allows to use them as keys when deduplicating states.
 */
public class ItemSet implements Iterable<Item>, Serializable {

	public static final ItemSet EMPTY = new ItemSet(Collections.emptyList());

	private final List<Item> items;

	private final int hashCode;

	public ItemSet(Collection<Item> items) {
		this.items = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(items)));
		this.hashCode = this.items.hashCode();
	}

	public static ItemSet of(Item... items){
		List<Item> list = new ArrayList<>();
		Collections.addAll(list, items);
		return new ItemSet(list);
	}

	/**
	 * Items in ascending order (production id, dot position)
	 */
	public List<Item> getItems(){
		return items;
	}

	public int size(){
		return items.size();
	}

	public boolean isEmpty(){
		return items.isEmpty();
	}

	public boolean contains(Item item){
		return Collections.binarySearch(items, item) >= 0;
	}

	public boolean containsAll(ItemSet other){
		for (Item item : other){
			if (!contains(item)){
				return false;
			}
		}
		return true;
	}

	@Override
	public Iterator<Item> iterator() {
		return items.iterator();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ItemSet && ((ItemSet)obj).hashCode == hashCode && ((ItemSet)obj).items.equals(items);
	}

	@Override
	public int hashCode() {
		return hashCode;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (int j = 0; j < items.size(); j++) {
			if (j != 0){
				builder.append("\n");
			}
			builder.append("- ").append(items.get(j));
		}
		return builder.toString();
	}
}
