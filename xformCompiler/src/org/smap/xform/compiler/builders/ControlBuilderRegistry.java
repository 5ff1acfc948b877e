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

package org.smap.xform.compiler.builders;

import java.util.EnumMap;
import java.util.Map;

import org.smap.xform.compiler.ItemsetNodesetCompiler;
import org.smap.xform.model.QuestionVariant;

/**
 * Registry of the control builder for each question variant
 */
public class ControlBuilderRegistry {

	private Map<QuestionVariant, IControlBuilder> builders;

	public ControlBuilderRegistry() {
		this.builders = new EnumMap<>(QuestionVariant.class);
	}

	/**
	 * Create a registry with a builder for every question variant
	 * @return The registry
	 */
	public static ControlBuilderRegistry createDefault() {
		ControlBuilderRegistry registry = new ControlBuilderRegistry();
		registry.register(new InputControlBuilder());
		registry.register(new TriggerControlBuilder());
		registry.register(new UploadControlBuilder());
		registry.register(new OsmUploadControlBuilder());
		registry.register(new RangeControlBuilder());
		registry.register(new MultipleChoiceControlBuilder(new ItemsetNodesetCompiler()));
		registry.register(new NoControlBuilder());
		return registry;
	}

	/**
	 * Register a builder, replacing any builder already registered for its variants
	 * @param builder The builder to register
	 */
	public void register(IControlBuilder builder) {
		for(QuestionVariant variant : builder.getVariants()) {
			builders.put(variant, builder);
		}
	}

	/**
	 * Get the builder for a variant
	 * @param variant The question variant
	 * @return The builder, or null if not found
	 */
	public IControlBuilder getBuilder(QuestionVariant variant) {
		return builders.get(variant);
	}

	/**
	 * Check that every variant has a builder
	 * @return true if no variant is missing a builder
	 */
	public boolean isComplete() {
		return builders.size() == QuestionVariant.values().length;
	}
}
