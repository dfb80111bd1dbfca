package nwk.trees.io.test;

import junit.framework.TestCase;
import nwk.trees.io.NewickTextNormalizer;

public class NewickTextNormalizerTest extends TestCase {
	public void testLengthsAreQuoted() {
		assertEquals("(A\":0.2\",B\":0.3\");", NewickTextNormalizer.normalize("(A:0.2,B:0.3);"));
		assertEquals("((A,B)\":1e-3\")R\":-2\";", NewickTextNormalizer.normalize("((A,B):1e-3)R:-2;"));
	}

	public void testLengthEndsAtWhitespaceAndComment() {
		assertEquals("(A\":0.1\" /*x*/,B);", NewickTextNormalizer.normalize("(A:0.1 [x],B);"));
		assertEquals("(A\":0.1\"/*x*/,B);", NewickTextNormalizer.normalize("(A:0.1[x],B);"));
		assertEquals("(A\":0.5\");", NewickTextNormalizer.normalize("(A: 0.5);"));
	}

	public void testComments() {
		assertEquals("/*&R*/ (A,B);", NewickTextNormalizer.normalize("[&R] (A,B);"));
		assertEquals("(A/*don't: split*/,B);", NewickTextNormalizer.normalize("(A[don't: split],B);"));
	}

	public void testQuotes() {
		assertEquals("(\"it's\",B);", NewickTextNormalizer.normalize("('it''s',B);"));
		assertEquals("(\"a:b [c]\",d);", NewickTextNormalizer.normalize("('a:b [c]',d);"));
		assertEquals("(\"say \\\"hi\\\"\",d);", NewickTextNormalizer.normalize("('say \"hi\"',d);"));
		assertEquals("(\"a\\\\b\");", NewickTextNormalizer.normalize("('a\\b');"));
		assertEquals("(\"it's\"\":1\");", NewickTextNormalizer.normalize("('it''s':1);"));
	}

	public void testStrayCommentEndIsLiteral() {
		assertEquals("(A]B);", NewickTextNormalizer.normalize("(A]B);"));
	}

	public void testUnterminatedQuoteIsKept() {
		assertEquals("(\"abc,d);", NewickTextNormalizer.normalize("('abc,d);"));
	}
}
