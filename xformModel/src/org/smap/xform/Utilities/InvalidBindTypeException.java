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
 * A select question has a bind type other than string or odk:rank
 */
public class InvalidBindTypeException extends ApplicationException {

	private static final long serialVersionUID = 4170906263573357331L;

	private String questionName;
	private String bindType;

	public InvalidBindTypeException(String msg, String questionName, String bindType) {
		super(msg);
		this.questionName = questionName;
		this.bindType = bindType;
	}

	public String getQuestionName() {
		return questionName;
	}

	public String getBindType() {
		return bindType;
	}
}
