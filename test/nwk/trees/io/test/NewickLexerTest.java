package nwk.trees.io.test;

import java.util.List;

import junit.framework.TestCase;
import nwk.trees.io.NewickFormatException;
import nwk.trees.io.NewickLexer;
import nwk.trees.io.NewickTextNormalizer;
import nwk.trees.io.NewickToken;

public class NewickLexerTest extends TestCase {
	public void testTokens() throws Exception {
		List<NewickToken> tokens = NewickLexer.tokenize("(A\":0.2\", B_c )\":1\";");
		assertEquals(8, tokens.size());
		assertToken(tokens.get(0), NewickToken.Type.OPEN, "(");
		assertToken(tokens.get(1), NewickToken.Type.LABEL, "A");
		assertToken(tokens.get(2), NewickToken.Type.LENGTH, ":0.2");
		assertToken(tokens.get(3), NewickToken.Type.COMMA, ",");
		assertToken(tokens.get(4), NewickToken.Type.LABEL, "B c");
		assertToken(tokens.get(5), NewickToken.Type.CLOSE, ")");
		assertToken(tokens.get(6), NewickToken.Type.LENGTH, ":1");
		assertToken(tokens.get(7), NewickToken.Type.END, ";");
		assertEquals(1, tokens.get(1).getOffset());
	}

	public void testQuotedLabelsKeepUnderscoresAndSpaces() throws Exception {
		List<NewickToken> tokens = NewickLexer.tokenize(NewickTextNormalizer.normalize("('Homo  sapiens_x',B);"));
		assertToken(tokens.get(1), NewickToken.Type.LABEL, "Homo  sapiens_x");
	}

	public void testCommentsAreSkipped() throws Exception {
		List<NewickToken> tokens = NewickLexer.tokenize("/* (,;) */(A/*x*/,B);");
		assertEquals(6, tokens.size());
		assertToken(tokens.get(0), NewickToken.Type.OPEN, "(");
		assertToken(tokens.get(1), NewickToken.Type.LABEL, "A");
		assertToken(tokens.get(2), NewickToken.Type.COMMA, ",");
	}

	public void testEscapes() throws Exception {
		List<NewickToken> tokens = NewickLexer.tokenize("(\"a\\\"b\\\\c\\u0041\\td\");");
		assertToken(tokens.get(1), NewickToken.Type.LABEL, "a\"b\\cA\td");
	}

	public void testFragmentsSplitAtQuotes() throws Exception {
		List<NewickToken> tokens = NewickLexer.tokenize(NewickTextNormalizer.normalize("(x'y z'w);"));
		assertEquals(6, tokens.size());
		assertToken(tokens.get(1), NewickToken.Type.LABEL, "x");
		assertToken(tokens.get(2), NewickToken.Type.LABEL, "y z");
		assertToken(tokens.get(3), NewickToken.Type.LABEL, "w");
	}

	public void testUnterminatedQuote() {
		try {
			NewickLexer.tokenize("(\"abc,d);");
			fail("Unterminated quote should fail");
		} catch (NewickFormatException e) {
			assertEquals(1, e.getOffset());
		}
	}

	public void testMalformedEscape() {
		assertMalformed("(\"a\\qb\");");
		assertMalformed("(\"a\\u00G1\");");
		assertMalformed("(\"a\\u00\");");
	}

	public void testUnterminatedComment() {
		assertMalformed("(A,B);/* open");
	}

	private void assertMalformed(String text) {
		try {
			NewickLexer.tokenize(text);
			fail("Text should not be tokenized: "+text);
		} catch (NewickFormatException e) {
			assertTrue(e.getOffset()>=0);
		}
	}

	private void assertToken(NewickToken token, NewickToken.Type type, String text) {
		assertEquals(type, token.getType());
		assertEquals(text, token.getText());
	}
}
