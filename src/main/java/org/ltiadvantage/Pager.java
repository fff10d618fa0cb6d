/*  LTI Advantage - A Java library for LTI 1.3 tools
*   Copyright (C) 2026 The LTI Advantage Authors
*   
*   This program is free software: you can redistribute it and/or modify
*   it under the terms of the GNU General Public License as published by
*   the Free Software Foundation, either version 3 of the License, or
*   (at your option) any later version.
*
*   This program is distributed in the hope that it will be useful,
*   but WITHOUT ANY WARRANTY; without even the implied warranty of
*   MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
*   GNU General Public License for more details.
*
*   You should have received a copy of the GNU General Public License
*   along with this program.  If not, see <http://www.gnu.org/licenses/>.
*/

package org.ltiadvantage;

import java.io.IOException;
import java.net.URI;
import java.util.NoSuchElementException;

/**
 * Walks a paginated platform collection one request at a time.
 *
 * The pager owns its cursor: the first call to nextPage() fetches the first page URI, and each
 * response's Link rel="next" header becomes the URI of the following call. When a response has
 * no next link, hasMorePages() turns false. A pager is meant for one sequential walk and is
 * not thread safe; start a new walk by asking the service client for a new pager.
 *
 * <pre>
 * Pager&lt;List&lt;Result&gt;&gt; pager = ags.getPagedResults(100, null);
 * while (pager.hasMorePages()) results.addAll(pager.nextPage());
 * </pre>
 *
 * @param <P> the decoded content of one page
 */
public class Pager<P> {

	/** Builds the request for one page URI. */
	interface RequestFactory {
		ServiceRequest create(String uri);
	}

	/** Decodes one page from its response. */
	interface PageReader<P> {
		P read(ServiceResponse response) throws IOException, ConnectorException;
	}

	private final Connector connector;
	private final RequestFactory requests;
	private final PageReader<P> reader;
	private String nextUri;
	private int pagesRead;

	Pager(Connector connector, String firstUri, RequestFactory requests, PageReader<P> reader) {
		this.connector = connector;
		this.nextUri = firstUri;
		this.requests = requests;
		this.reader = reader;
	}

	public boolean hasMorePages() {
		return nextUri != null;
	}

	/** The URI the next call to nextPage() will fetch, or null when the walk is complete. */
	public String getNextUri() {
		return nextUri;
	}

	public int getPagesRead() {
		return pagesRead;
	}

	/**
	 * Fetches the next page and advances the cursor.
	 * @throws NoSuchElementException if the last page was already read
	 */
	public P nextPage() throws ConnectorException {
		if (nextUri == null) throw new NoSuchElementException("There are no more pages.");
		String uri = nextUri;
		try (ServiceResponse response = connector.dispatch(requests.create(uri))) {
			P page = reader.read(response);
			nextUri = resolve(uri, response.nextPageUri());
			pagesRead++;
			return page;
		} catch (IOException e) {
			throw new ConnectorException("Unable to read the page at " + uri + ": " + e.getMessage(), e);
		}
	}

	// a Link target may be relative to the page that carried it
	static String resolve(String current, String next) throws ConnectorException {
		if (next == null) return null;
		try {
			return URI.create(current).resolve(next).toString();
		} catch (IllegalArgumentException e) {
			throw new ConnectorException("The next page link " + next + " is not a valid URI.", e);
		}
	}
}
