///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

/**
 * The kind of operation that a {@link ProvenanceEntry} records.
 */
public enum Operation {
    /** The first entry of every log */
    CREATE,

    /** A cube was constructed from array data */
    CONSTRUCT,

    /** A cube's metadata (or data) was replaced by a copy-and-update */
    UPDATE_METADATA,

    /** The rows were reversed */
    FLIP_UP_DOWN,

    /** The columns were reversed */
    FLIP_LEFT_RIGHT,

    /** The image was rotated by a multiple of 90 degrees */
    ROTATE_90,

    /** The data was repeated along one or more dimensions */
    TILE,

    /** The image was reshaped into a list of spectra */
    TO_SPECTRA_LIST,

    /** A list of spectra was reshaped into an image */
    FROM_SPECTRA_LIST,

    /** A rectangular region of the image was selected */
    CROP,

    /** A subset of the bands was selected */
    SELECT_BANDS,

    /** The spectra where a mask is true were selected */
    MASK,

    /** A list of spectra was placed back into an image by a mask */
    UNMASK,

    /** The spectra of the given pixels were selected */
    SELECT_PIXELS,

    /** The first spectra of the list form were selected */
    TAKE,

    /** Another cube was added */
    ADD,

    /** Another cube was subtracted */
    SUBTRACT,

    /** The cube was multiplied by another cube, element by element */
    MULTIPLY,

    /** The cube was divided by another cube, element by element */
    DIVIDE,

    /** A function was applied to every value */
    MAP,

    /** A function was applied to every spectrum */
    MAP_SPECTRA,

    /** A function was applied to the image of every band */
    MAP_BANDS,

    /** The image was reduced to its mean spectrum */
    MEAN,

    /** Each row was reduced to its mean spectrum */
    MEAN_OVER_ROWS,

    /** Each column was reduced to its mean spectrum */
    MEAN_OVER_COLUMNS,

    /** The image was reduced to its median spectrum */
    MEDIAN
}
