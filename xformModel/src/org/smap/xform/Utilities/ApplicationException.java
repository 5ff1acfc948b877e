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

package org.smap.xform.Utilities;

/*
 * Raised when a survey cannot be compiled into an XForm
 * The message is shown to the author of the survey so it names the survey elements involved
 */
public class ApplicationException extends Exception {

	private static final long serialVersionUID = 7546271236498410523L;

	public ApplicationException(String msg) {
		super(msg);
	}

	public ApplicationException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
