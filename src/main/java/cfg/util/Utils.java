package cfg.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Class with utility methods...
 */
public class Utils {

	/**
	 * Joins the string representations of several objects passed via a list.
	 *
	 * @param strs passed list of objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(List<T> strs, String separator){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < strs.size(); i++){
			if (i != 0){
				builder.append(separator);
			}
			builder.append(strs.get(i));
		}
		return builder.toString();
	}

	/**
	 * Formats a set as <code>{a, b, c}</code>, keeping its iteration order
	 */
	public static <T> String formatSet(Set<T> set){
		return "{" + join(new ArrayList<>(set), ", ") + "}";
	}

	@SafeVarargs
	public static <T> ArrayList<T> makeArrayList(T... elements){
		ArrayList<T> ret = new ArrayList<>(elements.length);
		for (int i = 0; i < elements.length; i++){
			ret.add(elements[i]);
		}
		return ret;
	}

	/**
	 * Concatenation of the passed list and the passed elements as a new list
	 */
	@SafeVarargs
	public static <T> List<T> append(List<T> list, T... elements){
		List<T> ret = new ArrayList<>(list);
		for (T element : elements){
			ret.add(element);
		}
		return ret;
	}

	/**
	 * Intersection of two sets that keeps the iteration order of the first set
	 */
	public static <T> Set<T> intersection(Set<T> first, Set<T> second){
		Set<T> ret = new LinkedHashSet<>(first);
		ret.retainAll(second);
		return ret;
	}
}
