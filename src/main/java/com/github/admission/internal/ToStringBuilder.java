package com.github.admission.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Standardizes the format of toString() return values.
 * <p>
 * Properties are printed one per line, with their values aligned.
 */
public final class ToStringBuilder
{
	private final String name;
	private final List<String> names = new ArrayList<>();
	private final List<String> values = new ArrayList<>();

	/**
	 * Creates a new builder.
	 *
	 * @param aClass the type of object being processed
	 * @throws NullPointerException if {@code aClass} is null
	 */
	public ToStringBuilder(Class<?> aClass)
	{
		requireThat(aClass, "aClass").isNotNull();
		this.name = aClass.getSimpleName();
	}

	/**
	 * Adds a property.
	 *
	 * @param name  the name of the property
	 * @param value the value of the property
	 * @return this
	 * @throws NullPointerException     if {@code name} is null
	 * @throws IllegalArgumentException if {@code name} is blank
	 */
	public ToStringBuilder add(String name, Object value)
	{
		requireThat(name, "name").isNotBlank();
		names.add(name);
		values.add(String.valueOf(value));
		return this;
	}

	@Override
	public String toString()
	{
		int maxNameLength = 0;
		for (String property : names)
			maxNameLength = Math.max(maxNameLength, property.length());

		StringJoiner output = new StringJoiner(",\n\t", "\t", "");
		for (int i = 0, size = names.size(); i < size; ++i)
		{
			String property = names.get(i);
			String padding = " ".repeat(maxNameLength - property.length());
			output.add(property + padding + ": " + values.get(i).replace("\n", "\n\t"));
		}
		return name + "\n" +
			"{\n" +
			output + "\n" +
			"}";
	}
}
