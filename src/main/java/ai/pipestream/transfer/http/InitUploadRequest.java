package ai.pipestream.transfer.http;

import ai.pipestream.transfer.session.FileDeclaration;

import java.util.List;

public record InitUploadRequest(List<FileDeclaration> files, String credential) {
}
