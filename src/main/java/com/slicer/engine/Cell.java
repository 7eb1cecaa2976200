package com.slicer.engine;

import com.slicer.engine.cut.Cut;
import lombok.Value;

import java.util.List;

/**
 * Conjunction of cuts restricting a cube. Immutable.
 *
 * A cell with no cuts covers the whole cube; "no cell requested" is expressed
 * with null, not with an empty cell.
 */
@Value
public class Cell {

    Cube cube;
    List<Cut> cuts;

    public Cell(Cube cube, List<Cut> cuts) {
        this.cube = cube;
        this.cuts = List.copyOf(cuts);
    }
}
