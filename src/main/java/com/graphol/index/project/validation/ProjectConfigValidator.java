package com.graphol.index.project.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.graphol.index.project.ProjectConfig;
import com.graphol.index.project.exception.ProjectConfigValidationException;

public class ProjectConfigValidator {

	public static final Set<String> PROFILES = Set.of("OWL 2", "OWL 2 QL", "OWL 2 RL");

	private static final Pattern PREFIX = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.-]*$");

	public ProjectConfig validate(ProjectConfig c) {
		List<String> errors = new ArrayList<>();

		if (c == null) {
			throw new ProjectConfigValidationException(List.of("Project configuration is required."));
		}

		if (isBlank(c.getName())) {
			errors.add("Project name is required.");
		}

		if (isBlank(c.getVersion())) {
			errors.add("Project version is required.");
		}

		if (c.getProfile() == null || !PROFILES.contains(c.getProfile())) {
			errors.add("Unsupported profile: " + c.getProfile() + ". Expected one of " + PROFILES + ".");
		}

		if (!isBlank(c.getIri()) && !isAbsoluteUri(c.getIri().trim())) {
			errors.add("Project IRI must be an absolute IRI. Got: " + c.getIri());
		}

		if (!isBlank(c.getPrefix()) && !PREFIX.matcher(c.getPrefix().trim()).matches()) {
			errors.add("Project prefix is not a valid prefix name. Got: " + c.getPrefix());
		}

		// A prefix without an IRI to expand to is useless
		if (!isBlank(c.getPrefix()) && isBlank(c.getIri())) {
			errors.add("Project prefix '" + c.getPrefix() + "' requires a project IRI.");
		}

		if (!errors.isEmpty()) {
			throw new ProjectConfigValidationException(errors);
		}

		return c;
	}

	private static boolean isAbsoluteUri(String s) {
		try {
			return new URI(s).isAbsolute();
		} catch (URISyntaxException e) {
			return false;
		}
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
