// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package vspec.util;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A print writer which records, for every printed fragment of text, the tag it
 * was printed for. This allows a (line, column) position in the printed output
 * to be mapped back to the item responsible for it.
 *
 * @param <T>
 */
public class MappablePrintWriter<T> {
	private final PrintWriter out;
	private final Mapping<T> mapping;
	private int index;

	public MappablePrintWriter(OutputStream os) {
		this(new PrintWriter(new OutputStreamWriter(os, StandardCharsets.UTF_8)));
	}

	public MappablePrintWriter(PrintWriter writer) {
		this.out = writer;
		this.mapping = new Mapping<>();
	}

	public Mapping<T> getMapping() {
		return mapping;
	}

	/**
	 * Print a string associated with a given tag.
	 *
	 * @param text
	 * @param tag
	 */
	public void print(String text, T tag) {
		out.print(text);
		mapping.put(tag, index, text.length());
		index += text.length();
	}

	/**
	 * Print a newline.
	 */
	public void println() {
		out.println();
		mapping.newLine();
		index = 0;
	}

	public void flush() {
		out.flush();
	}

	public void close() {
		out.close();
	}

	public static class Mapping<T> {
		private final ArrayList<ArrayList<Span<T>>> lines = new ArrayList<>();

		public Mapping() {
			newLine();
		}

		public void put(T tag, int start, int length) {
			int end = (start + length) - 1;
			ArrayList<Span<T>> line = lines.get(lines.size() - 1);
			line.add(new Span<>(tag, start, end));
		}

		public void newLine() {
			lines.add(new ArrayList<>());
		}

		/**
		 * Get the tag responsible for the text at a given line and column. Lines are
		 * numbered from 1, whilst columns are numbered from 0.
		 *
		 * @param line
		 * @param col
		 * @return
		 */
		public T get(int line, int col) {
			line = line - 1;
			//
			if (line < 0 || line >= lines.size()) {
				return null;
			} else {
				List<Span<T>> l = lines.get(line);
				for (int i = 0; i != l.size(); ++i) {
					Span<T> s = l.get(i);
					if (s.contains(col)) {
						return s.tag;
					}
				}
				return null;
			}
		}
	}

	/**
	 * Represents a given region of text.
	 */
	private static class Span<T> {
		private final T tag;
		private final int start;
		private final int end;

		public Span(T tag, int start, int end) {
			this.tag = tag;
			this.start = start;
			this.end = end;
		}

		public boolean contains(int col) {
			return start <= col && col <= end;
		}
	}
}
