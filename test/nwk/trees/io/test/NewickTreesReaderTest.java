package nwk.trees.io.test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import junit.framework.TestCase;
import nwk.trees.CladeRemovalResult;
import nwk.trees.NewickNode;
import nwk.trees.io.NewickFormatException;
import nwk.trees.io.NewickTreesReader;

public class NewickTreesReaderTest extends TestCase {
	private static final String TREE = "(((A:0.2,B:0.3):0.3,(D:0.5,E:0.3):0.2):0.3,F:0.7);";
	private static final String UNIFORM = "(((n13:0.2,n14:0.3)n12:0.3,(n16:0.5,n17:0.3)n15:0.2)n11:0.3,n18:0.7)n10;";

	public void testReferenceFile() throws Exception {
		NewickNode root = null;
		int n = 0;
		try (InputStream is = getClass().getResourceAsStream("/nwk/trees/io/test/test.nwk");
			 NewickTreesReader reader = new NewickTreesReader(is)) {
			while (reader.advance()) {
				root = reader.getCurrentTree();
				assertEquals(TREE, root.toString());
				n++;
			}
			assertEquals(2, n);
			assertNull(reader.getCurrentText());

			assertEquals(10, root.getId());
			root.uniformLabels("n");
			assertEquals(UNIFORM, root.toString());
			assertEquals("n10$n11$n12$n13$n14$n15$n16$n17$n18", root.getKey("$"));

			NewickNode n1 = root.getFirstChild().getFirstChild().getFirstChild();
			NewickNode n2 = root.getFirstChild().getFirstChild().getNextSibling().getFirstChild();
			NewickNode l1 = n1.getLCA(n2);
			NewickNode l2 = n2.getLCA(n1);
			assertEquals(11, l1.getId());
			assertTrue(l1.isSameNode(l2));
			assertEquals(0.8, n1.upDistance(root), 1e-12);

			NewickNode ch = reader.getIds().createNode("new");
			root.addChild(ch);
			assertEquals("(((n13:0.2,n14:0.3)n12:0.3,(n16:0.5,n17:0.3)n15:0.2)n11:0.3,n18:0.7,new)n10;", root.toString());
			root.removeChild(ch.getId());
			assertEquals(UNIFORM, root.toString());

			String expected = "n10\n   n18\n   n11\n      n15\n         n17\n" +
					"         n16\n      n12\n         n14\n         n13\n";
			assertEquals(expected, root.print());
		}
	}

	public void testRemoveCladeReferenceTree() throws Exception {
		try (InputStream is = getClass().getResourceAsStream("/nwk/trees/io/test/reference9.nwk");
			 NewickTreesReader reader = new NewickTreesReader(is)) {
			assertTrue(reader.advance());
			assertEquals("((T1:47,(T5:31)3:10)4:1,(T2:12,(T3:8)7:4)8:2)9;", reader.getCurrentText());
			NewickNode root = reader.getCurrentTree();
			assertEquals(1, root.getId());
			assertEquals(9, root.getSize());
			assertEquals("((T1:47,(T5:31)3:10)4:1,(T2:12,(T3:8)7:4)8:2)9;", root.toString());

			NewickNode clade = root.getFirstChild().getFirstChild().getNextSibling();
			assertEquals("3", clade.getLabel());
			assertEquals(CladeRemovalResult.DETACHED, clade.removeClade());
			assertEquals("((T1:47)4:1,(T2:12,(T3:8)7:4)8:2)9;", root.toString());
			assertTrue(clade.isRoot());
			assertEquals("(T5:31)3;", clade.toString());
			assertEquals(CladeRemovalResult.TREE_DESTROYED, root.removeClade());
			assertFalse(reader.advance());
		}
	}

	public void testCurrentTreeCreatesFreshNodes() throws Exception {
		try (NewickTreesReader reader = new NewickTreesReader(stream("(A,B);"))) {
			assertTrue(reader.advance());
			NewickNode t1 = reader.getCurrentTree();
			NewickNode t2 = reader.getCurrentTree();
			assertEquals(1, t1.getId());
			assertEquals(4, t2.getId());
			assertEquals(t1.toString(), t2.toString());
		}
	}

	public void testSkipsTextBetweenRecords() throws Exception {
		String input = "#header line\n[comment with ( and ;] (A,B)X;\n  junk; (C,'D;E')Y; trailing text";
		List<String> texts = new ArrayList<>();
		try (NewickTreesReader reader = new NewickTreesReader(stream(input))) {
			while (reader.advance()) texts.add(reader.getCurrentText());
			assertEquals(2, reader.getRecordsRead());
		}
		assertEquals(2, texts.size());
		assertEquals("(A,B)X;", texts.get(0));
		assertEquals("(C,'D;E')Y;", texts.get(1));
	}

	public void testSemicolonInsideComment() throws Exception {
		try (NewickTreesReader reader = new NewickTreesReader(stream("(A[x;y],B);"))) {
			assertTrue(reader.advance());
			assertEquals("(A,B);", reader.getCurrentTree().toString());
		}
	}

	public void testTruncatedRecord() throws Exception {
		try (NewickTreesReader reader = new NewickTreesReader(stream("(A,B); (C,D"))) {
			assertTrue(reader.advance());
			try {
				reader.advance();
				fail("Truncated record should not be accepted");
			} catch (NewickFormatException e) {
				assertTrue(e.getMessage().contains("(C,D"));
			}
		}
	}

	public void testEmptyInput() throws Exception {
		try (NewickTreesReader reader = new NewickTreesReader(stream("  no trees here;\n"))) {
			assertFalse(reader.advance());
			assertNull(reader.getCurrentText());
		}
	}

	public void testIterator() throws Exception {
		List<String> trees = new ArrayList<>();
		try (NewickTreesReader reader = new NewickTreesReader(stream("(A,B);\n(C,(D,E));\n"))) {
			for (NewickNode root : reader) trees.add(root.toString());
		}
		assertEquals(2, trees.size());
		assertEquals("(A,B);", trees.get(0));
		assertEquals("(C,(D,E));", trees.get(1));
	}

	public void testIteratorMalformedTree() throws Exception {
		try (NewickTreesReader reader = new NewickTreesReader(stream("(A,B));"))) {
			try {
				reader.iterator();
				fail("Unbalanced tree should fail");
			} catch (RuntimeException e) {
				assertTrue(e.getCause() instanceof NewickFormatException);
			}
		}
	}

	public void testClosedReader() throws Exception {
		NewickTreesReader reader = new NewickTreesReader(stream("(A,B);"));
		reader.close();
		try {
			reader.iterator();
			fail("Closed reader can not be iterated");
		} catch (IllegalStateException e) {
			assertTrue(e.getMessage().contains("closed"));
		}
		try {
			reader.advance();
			fail("Closed reader can not advance");
		} catch (IllegalStateException e) {
			assertTrue(e.getMessage().contains("closed"));
		}
		reader.close();
	}

	public void testGzipFile() throws Exception {
		File file = File.createTempFile("trees", ".nwk.gz");
		file.deleteOnExit();
		try (Writer out = new OutputStreamWriter(new GZIPOutputStream(new FileOutputStream(file)), StandardCharsets.UTF_8)) {
			out.write("(A:1,B:2)R;\n");
		}
		try (NewickTreesReader reader = new NewickTreesReader(file)) {
			assertTrue(reader.advance());
			NewickNode root = reader.getCurrentTree();
			assertEquals("R", root.getLabel());
			assertEquals(3.0, root.getBranchLengthSum(), 1e-12);
			assertFalse(reader.advance());
		}
	}

	private InputStream stream(String text) throws IOException {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}
}
