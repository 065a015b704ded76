package lrgen.util;

import java.util.Collection;
import java.util.logging.Logger;

/**
 * Class with utility methods...
 */
public class Utils {

	/**
	 * Logger of the whole generator, its level is set by the default configuration
	 */
	public static final Logger LOG = Logger.getLogger("lrgen");

	/**
	 * The dpi of images produced by graphviz from the automaton
	 */
	public static final int GRAPHVIZ_IMAGE_DPI = 300;

	/**
	 * Joins the string representations of several objects.
	 *
	 * @param objs passed objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> objs, String separator){
		StringBuilder builder = new StringBuilder();
		boolean first = true;
		for (T obj : objs){
			if (!first){
				builder.append(separator);
			}
			builder.append(obj);
			first = false;
		}
		return builder.toString();
	}

	public static String escapeHtml(String text){
		String ret = text + "";
		String[] search = new String[]{"&", "\"", "<", ">", "•"};
		String[] replacement = new String[]{"&amp;", "&quot;", "&lt;", "&gt;", "&bull;"};
		for (int i = 0; i < search.length; i++){
			ret = ret.replace(search[i], replacement[i]);
		}
		return ret;
	}
}
