package org.lawlinks.core.nlp;

/*
 * This file is part of LawLinks.
 *
 * Copyright (C) 2025 LawLinks contributors
 *
 * LawLinks is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * LawLinks is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with LawLinks.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.util.Optional;

/**
 * Russian morphology: maps an inflected word to its dictionary form.
 * <p>
 * Implementations answer {@link Optional#empty()} when they do not know the
 * word. Callers must not rely on implementations never throwing;
 * {@link Lemmatizer} guards every call.
 */
@FunctionalInterface
public interface Morphology {

	/**
	 * @param word a single Cyrillic word, any case
	 * @return the normal form in lower case, or empty when unknown
	 */
	Optional<String> normalForm(String word);
}
