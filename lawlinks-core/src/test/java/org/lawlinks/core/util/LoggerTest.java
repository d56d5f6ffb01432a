package org.lawlinks.core.util;

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LoggerTest {

	@Test
	void placeholdersAreFilledInOrder() {
		assertEquals("law 10 article 5", Logger.format("law {} article {}", 10, "5"));
	}

	@Test
	void surplusArgumentsAreAppended() {
		assertEquals("done 1 2", Logger.format("done {}", 1, 2));
	}

	@Test
	void missingArgumentsLeavePlaceholders() {
		assertEquals("a x b {}", Logger.format("a {} b {}", "x"));
		assertEquals("no args {}", Logger.format("no args {}"));
		assertEquals("null", Logger.format(null));
	}

	@Test
	void errorIsAlwaysEnabled() {
		assertTrue(Logger.isEnabled(Logger.Level.ERROR));
	}
}
