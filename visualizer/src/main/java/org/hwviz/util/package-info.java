@ParametersAreNonnullByDefault
@FieldsAreNonnullByDefault
@MethodsAreNonnullByDefault
package org.hwviz.util;

import javax.annotation.ParametersAreNonnullByDefault;
