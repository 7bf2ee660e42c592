package server;

import command.CommandHandler;
import protocol.RespFormatException;
import protocol.RespProtocol;
import protocol.RespReader;
import protocol.RespValue;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.util.Arrays;
import java.util.List;

/**
 * 클라이언트 연결 하나를 처리하는 클래스
 * 요청 바이트를 읽고, 완성된 명령어를 하나씩 실행한 뒤 다음 명령어를 디코딩하기 전에 응답을 보냅니다.
 */
public class ClientHandler implements Runnable {

    private static final int READ_CHUNK_SIZE = 4096;

    private final Socket clientSocket;
    private final CommandHandler commandHandler;

    private byte[] buffer = new byte[READ_CHUNK_SIZE];
    private int buffered;

    public ClientHandler(Socket clientSocket, CommandHandler commandHandler) {
        this.clientSocket = clientSocket;
        this.commandHandler = commandHandler;
    }

    @Override
    public void run() {
        String clientAddress = String.valueOf(clientSocket.getRemoteSocketAddress());

        try (InputStream inputStream = clientSocket.getInputStream();
             OutputStream outputStream = clientSocket.getOutputStream()) {

            serve(inputStream, outputStream);

        } catch (SocketException e) {
            System.out.println("Client disconnected: " + clientAddress + " (" + e.getMessage() + ")");
        } catch (IOException e) {
            System.err.println("Error handling client " + clientAddress + ": " + e.getMessage());
        } finally {
            try {
                clientSocket.close();
            } catch (IOException e) {
                System.err.println("Error closing client socket " + clientAddress + ": " + e.getMessage());
            }
        }

        System.out.println("Client connection closed: " + clientAddress);
    }

    /**
     * 상대가 스트림을 닫을 때까지 요청 루프를 실행합니다.
     */
    void serve(InputStream inputStream, OutputStream outputStream) throws IOException {
        byte[] chunk = new byte[READ_CHUNK_SIZE];
        int read;
        while ((read = inputStream.read(chunk)) != -1) {
            append(chunk, read);
            processBuffered(outputStream);
        }
    }

    private void processBuffered(OutputStream outputStream) throws IOException {
        RespReader reader = new RespReader(buffer, 0, buffered);
        while (true) {
            List<String> args;
            try {
                args = reader.readCommand();
            } catch (RespFormatException e) {
                // 나머지 버퍼는 프레임 경계를 알 수 없으므로 버림
                System.err.println("Protocol error: " + e.getMessage());
                sendResponse(outputStream, RespValue.error("Protocol error: " + e.getMessage()));
                buffered = 0;
                return;
            } catch (RuntimeException e) {
                System.err.println("Error decoding request: " + e);
                sendResponse(outputStream, RespValue.error("internal server error"));
                buffered = 0;
                return;
            }
            if (args == null) {
                break;
            }
            sendResponse(outputStream, commandHandler.execute(args));
        }
        compact(reader.getPosition());
    }

    private void append(byte[] chunk, int length) {
        if (buffered + length > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, buffered + length));
        }
        System.arraycopy(chunk, 0, buffer, buffered, length);
        buffered += length;
    }

    private void compact(int consumed) {
        if (consumed == 0) {
            return;
        }
        System.arraycopy(buffer, consumed, buffer, 0, buffered - consumed);
        buffered -= consumed;
    }

    /**
     * 클라이언트에게 응답을 전송합니다.
     */
    private void sendResponse(OutputStream outputStream, RespValue response) throws IOException {
        outputStream.write(RespProtocol.encode(response));
        outputStream.flush();
    }
}
