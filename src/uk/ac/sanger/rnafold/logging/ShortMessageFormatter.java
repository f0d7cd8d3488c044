// Copyright (c) 2001-2014 Genome Research Ltd.
//
// Authors: David Harper
//          Ed Zuiderwijk
//          Kate Taylor
//
// This file is part of RnaFold.
//
// RnaFold is free software: you can redistribute it and/or modify it under
// the terms of the GNU General Public License as published by the Free Software
// Foundation; either version 3 of the License, or (at your option) any later
// version.
//
// This program is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// this program. If not, see <http://www.gnu.org/licenses/>.

package uk.ac.sanger.rnafold.logging;

import java.util.logging.LogRecord;

/**
 * Console format. Exceptions are summarised, showing only the stack frames
 * of RnaFold classes unless the trace is short.
 */
public class ShortMessageFormatter extends AbstractFormatter {
	private static final int SHORT_TRACE_LENGTH = 10;

	public String format(LogRecord record) {
		StringBuffer sb = new StringBuffer();

		formatForMessage(sb, record);

		if (record.getThrown() != null)
			formatForException(sb, record.getThrown());

		return sb.toString();
	}

	private void formatForException(StringBuffer sb, Throwable throwable) {
		sb.append(throwable.getClass().getName() + ": "
				+ throwable.getMessage() + "\n");

		StackTraceElement[] ste = throwable.getStackTrace();

		boolean showAll = ste.length <= SHORT_TRACE_LENGTH;

		for (int i = 0; i < ste.length; i++)
			if (showAll || ste[i].getClassName().startsWith(PACKAGE_PREFIX))
				sb.append("  [" + i + "]: " + ste[i] + "\n");

		Throwable cause = throwable.getCause();

		if (cause != null) {
			sb.append("\nCAUSE: " + cause.getClass().getName() + " : "
					+ cause.getMessage() + "\n");

			ste = cause.getStackTrace();

			for (int i = 0; i < ste.length; i++)
				if (ste[i].getClassName().startsWith(PACKAGE_PREFIX))
					sb.append("  [" + i + "]: " + ste[i] + "\n");
		}
	}
}
