package org.lawlinks.core.alias;

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

/**
 * The alias mapping cannot be turned into a usable index. Thrown once at
 * startup; the owning process should stop rather than retry.
 */
public class AliasIndexException extends Exception {

	private static final long serialVersionUID = 1L;

	public AliasIndexException(String message) {
		super(message);
	}

	public AliasIndexException(String message, Throwable cause) {
		super(message, cause);
	}
}
