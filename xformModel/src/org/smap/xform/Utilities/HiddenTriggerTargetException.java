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
 * A setvalue trigger refers to a question that has no control in the body of the form
 * There is nothing for the xforms-value-changed event to be attached to
 */
public class HiddenTriggerTargetException extends ApplicationException {

	private static final long serialVersionUID = -5839166524460171892L;

	private String hiddenQuestion;
	private String triggeredQuestion;

	public HiddenTriggerTargetException(String msg, String hiddenQuestion, String triggeredQuestion) {
		super(msg);
		this.hiddenQuestion = hiddenQuestion;
		this.triggeredQuestion = triggeredQuestion;
	}

	public String getHiddenQuestion() {
		return hiddenQuestion;
	}

	public String getTriggeredQuestion() {
		return triggeredQuestion;
	}
}
