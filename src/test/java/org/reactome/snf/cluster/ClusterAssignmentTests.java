package org.reactome.snf.cluster;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;
import org.reactome.snf.Dataset;
import org.reactome.snf.FeatureColumn;
import org.reactome.snf.ValidationException;
import org.reactome.snf.View;

import smile.data.vector.IntVector;

public class ClusterAssignmentTests {
    
    @Test
    public void testFromColumn() {
        Dataset subtypes = new Dataset(View.SUBTYPES,
                                       new String[] {"p1", "p2", "p3", "p4"},
                                       Collections.singletonList(FeatureColumn.categorical("Subtype", new String[] {"iC2", null, "iC1", "iC2"})));
        ClusterAssignment assignment = ClusterAssignment.fromColumn(subtypes, "Subtype");
        assertEquals(3, assignment.size());
        assertFalse(assignment.contains("p2"));
        assertArrayEquals(new String[] {"p1", "p3", "p4"}, assignment.getSampleIds());
        assertArrayEquals(new int[] {1, 0, 1}, assignment.getLabels());
        assertEquals(2, assignment.getClusterCount());
        assertArrayEquals(new int[] {1, 1}, assignment.getLabels(Arrays.asList("p4", "p1")));
    }
    
    @Test
    public void testToVector() {
        ClusterAssignment assignment = new ClusterAssignment(new String[] {"a", "b", "c"}, new int[] {2, 0, 2});
        IntVector vector = assignment.toVector();
        assertEquals(ClusterAssignment.CLUSTER_COLUMN, vector.name());
        assertEquals(3, vector.size());
        assertEquals(0, vector.getInt(1));
    }
    
    @Test(expected = ValidationException.class)
    public void testDuplicatedSample() {
        new ClusterAssignment(new String[] {"a", "a"}, new int[] {0, 1});
    }
    
}
