package info.isaksson.erland.modelimport.apply;

import java.util.UUID;

final class RandomIdAllocator implements IdAllocator {

    @Override
    public String next(String prefix, String sourceKey) {
        return prefix + "_" + UUID.randomUUID();
    }
}
