package cfg.util;

import java.util.*;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

	@Test
	public void testJoin(){
		assertEquals("a, b, c", Utils.join(Arrays.asList("a", "b", "c"), ", "));
		assertEquals("", Utils.join(Collections.emptyList(), ", "));
	}

	@Test
	public void testFormatSet(){
		assertEquals("{$, b}", Utils.formatSet(new LinkedHashSet<>(Arrays.asList("$", "b"))));
		assertEquals("{}", Utils.formatSet(Collections.emptySet()));
	}

	@Test
	public void testIntersectionKeepsOrder(){
		Set<String> first = new LinkedHashSet<>(Arrays.asList("c", "a", "b"));
		Set<String> second = new HashSet<>(Arrays.asList("a", "c", "x"));
		assertEquals(Arrays.asList("c", "a"), new ArrayList<>(Utils.intersection(first, second)));
		assertEquals(3, first.size());
	}

	@Test
	public void testAppend(){
		List<String> list = Arrays.asList("a");
		assertEquals(Arrays.asList("a", "b", "c"), Utils.append(list, "b", "c"));
		assertEquals(1, list.size());
	}
}
