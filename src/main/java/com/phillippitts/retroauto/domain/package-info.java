/**
 * Value types shared by the parser, the executor, the interrupt supervisor and the
 * external vision/input contracts.
 */
package com.phillippitts.retroauto.domain;
