/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.zipper;

/**
 * Thrown when an edit has no meaning at the current position, such as
 * removing the root node or inserting a sibling next to it.
 */
@SuppressWarnings("serial")
public class ZipperException extends RuntimeException {
    public ZipperException(String message) {
        super(message);
    }
}
