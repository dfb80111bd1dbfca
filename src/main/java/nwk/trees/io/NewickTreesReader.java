/*******************************************************************************
 * NWK - Newick trees parsing and manipulation
 * Copyright 2016 Jorge Duitama
 *
 * This file is part of NWK.
 *
 *     NWK is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     NWK is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with NWK.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package nwk.trees.io;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

import nwk.trees.NewickNode;
import nwk.trees.NodeIdGenerator;

/**
 * Reads trees in Newick format one record at a time. A record starts at an opening parenthesis and ends
 * at the next semicolon that is not part of a quoted label or a comment
 * @author Jorge Duitama
 *
 */
public class NewickTreesReader implements Iterable<NewickNode>,Closeable {

	private Logger log = Logger.getLogger(NewickTreesReader.class.getName());

	private BufferedReader in;

	private NewickTreesIterator currentIterator = null;

	private NodeIdGenerator ids = new NodeIdGenerator();

	private String currentText = null;

	private int recordsRead = 0;

	public NewickTreesReader (String filename) throws IOException {
		init(null,new File(filename));
	}
	public NewickTreesReader (File file) throws IOException {
		init(null,file);
	}
	public NewickTreesReader (InputStream stream) throws IOException {
		init(stream,null);
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}

	/**
	 * @return NodeIdGenerator generator used to assign ids to the nodes of the trees loaded by this reader
	 */
	public NodeIdGenerator getIds() {
		return ids;
	}
	/**
	 * Changes the generator of node ids. Useful to share ids among trees loaded from different sources
	 * @param ids New generator
	 */
	public void setIds(NodeIdGenerator ids) {
		if (ids == null) throw new NullPointerException("Id generator can not be null");
		this.ids = ids;
	}

	/**
	 * @return int number of records read so far
	 */
	public int getRecordsRead() {
		return recordsRead;
	}

	@Override
	public void close() throws IOException {
		if (in == null) return;
		in.close();
		in = null;
	}

	@Override
	public Iterator<NewickNode> iterator() {
		if (in == null) {
			throw new IllegalStateException("File reader is closed");
		}
		if (currentIterator != null) {
			throw new IllegalStateException("Iteration in progress");
		}
		currentIterator = new NewickTreesIterator();
		return currentIterator;
	}

	private void init (InputStream stream, File file) throws IOException {
		if (stream != null && file != null) throw new IllegalArgumentException("Stream and file are mutually exclusive");
		if(file!=null) {
			stream = new FileInputStream(file);
			if(file.getName().toLowerCase().endsWith(".gz")) {
				stream = new GZIPInputStream(stream);
			}
		}
		in = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
	}

	/**
	 * Reads the next record. Text before the first opening parenthesis is discarded
	 * @return boolean true if a new record was read, false if the input does not have more trees
	 * @throws NewickFormatException If the input ends before the semicolon that terminates the record
	 * @throws IOException If the input can not be read
	 */
	public boolean advance() throws IOException {
		if (in == null) throw new IllegalStateException("File reader is closed");
		currentText = null;
		int c;
		int discarded = 0;
		boolean inComment = false;
		while ((c = in.read()) != -1) {
			if (inComment) {
				if (c == NewickTextNormalizer.NEWICK_COMMENT_END) inComment = false;
			} else if (c == NewickTextNormalizer.NEWICK_COMMENT_START) {
				inComment = true;
			} else if (c == '(') {
				break;
			}
			if (!Character.isWhitespace(c)) discarded++;
		}
		if (discarded>0) log.fine("Discarded "+discarded+" characters before record "+(recordsRead+1));
		if (c == -1) return false;
		StringBuilder record = new StringBuilder();
		record.append((char)c);
		boolean inQuote = false;
		while ((c = in.read()) != -1) {
			record.append((char)c);
			if (inComment) {
				if (c == NewickTextNormalizer.NEWICK_COMMENT_END) inComment = false;
			} else if (inQuote) {
				if (c == NewickTextNormalizer.NEWICK_QUOTE) inQuote = false;
			} else if (c == NewickTextNormalizer.NEWICK_COMMENT_START) {
				inComment = true;
			} else if (c == NewickTextNormalizer.NEWICK_QUOTE) {
				inQuote = true;
			} else if (c == ';') {
				currentText = record.toString();
				recordsRead++;
				return true;
			}
		}
		throw new NewickFormatException("Input ended before the end of record "+(recordsRead+1)+". Text: "+record);
	}

	/**
	 * @return String raw text of the last record read. null if the last call to advance returned false
	 */
	public String getCurrentText() {
		return currentText;
	}

	/**
	 * Parses the last record read. Each call builds a new tree with fresh ids
	 * @return NewickNode root of the tree
	 * @throws NewickFormatException If the record is malformed
	 */
	public NewickNode getCurrentTree() throws NewickFormatException {
		if (currentText == null) throw new IllegalStateException("No record available. Call advance first");
		NewickTreeBuilder builder = new NewickTreeBuilder(ids);
		builder.setLog(log);
		return builder.parse(currentText);
	}

	private class NewickTreesIterator implements Iterator<NewickNode> {
		private NewickNode nextRecord;
		public NewickTreesIterator() {
			nextRecord = loadRecord();
		}
		@Override
		public boolean hasNext() {
			return nextRecord!=null;
		}

		@Override
		public NewickNode next() {
			if(nextRecord==null) throw new NoSuchElementException();
			NewickNode answer = nextRecord;
			nextRecord = loadRecord();
			return answer;
		}

		private NewickNode loadRecord() {
			try {
				if(!advance()) return null;
				return getCurrentTree();
			} catch (IOException e) {
				throw new RuntimeException(e);
			}
		}
		@Override
		public void remove() {
			throw new UnsupportedOperationException("Remove not supported by NewickTreesIterator");
		}
	}
}
