package dev.vibeshowcase.dto;

import dev.vibeshowcase.entity.GalleryImage;

public record GalleryImageResponse(Long id, String imageUrl, String caption, Integer displayOrder) {

    public static GalleryImageResponse fromEntity(GalleryImage image) {
        return new GalleryImageResponse(image.getId(), image.getImageUrl(), image.getCaption(), image.getDisplayOrder());
    }
}
