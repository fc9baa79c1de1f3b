package io.github.jakubt4.earendil.catalog;

/**
 * Header entry for one density pass of a cell file.
 *
 * @param density     quads per square degree in this pass
 * @param recordCount number of quad records
 * @param dataOffset  absolute file offset of the first record
 */
public record PassDescriptor(float density, int recordCount, long dataOffset) {

    public long byteLength() {
        return (long) recordCount * QuadCatalogFormat.RECORD_LENGTH;
    }
}
