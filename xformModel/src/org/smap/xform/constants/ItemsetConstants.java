/*****************************************************************************

This file is part of SMAP.

SMAP is free software: you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation, either version 3 of the License, or
(at your option) any later version.

SMAP is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with SMAP.  If not, see <http://www.gnu.org/licenses/>.

 ******************************************************************************/

package org.smap.xform.constants;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ItemsetConstants {

	// Value and label references for choices loaded into a secondary instance
	public static final String ITEMSET_REF_VALUE = "value";
	public static final String ITEMSET_REF_LABEL = "label";
	public static final String ITEMSET_REF_VALUE_GEOJSON = "id";
	public static final String ITEMSET_REF_LABEL_GEOJSON = "title";

	public static final String ITEXT_LABEL_REF = "jr:itext(itextId)";

	public static final String GEOJSON_EXTENSION = ".geojson";

	// File extensions of itemsets that are attached to the form as secondary instances
	public static final List<String> EXTERNAL_INSTANCE_EXTENSIONS =
			Collections.unmodifiableList(Arrays.asList(".xml", ".csv", ".geojson"));

	public static final String LAST_SAVED_INSTANCE = "__last-saved";

	// Parameters of a select question
	public static final String PARAM_VALUE = "value";
	public static final String PARAM_LABEL = "label";
	public static final String PARAM_RANDOMIZE = "randomize";
	public static final String PARAM_SEED = "seed";
}
