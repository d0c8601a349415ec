////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.epubcfi.tree;

import java.util.List;

import com.tomaszrup.epubcfi.model.Step;

/**
 * Fast-path lookup of the node a list of unfiltered steps points at, using a
 * query facility of the host tree (XPath for W3C DOM). Must agree with the
 * manual walk in {@link Resolver}.
 *
 * @param <N> the host's node type
 */
public interface PathQuery<N> {

	/**
	 * @return the addressed node, or {@code null} when the query matches nothing
	 *         or the steps cannot be expressed as a query
	 */
	N select(List<Step> steps);
}
